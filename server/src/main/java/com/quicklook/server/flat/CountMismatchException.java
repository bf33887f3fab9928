package com.quicklook.server.flat;

/**
 * The flat directory does not hold one file per detector.
 */
public class CountMismatchException extends Exception {

    private final int found;
    private final int expected;

    public CountMismatchException(int found, int expected) {
        super("Number of flat files (" + found + ") does not match number of CCDs (" + expected + ")");
        this.found = found;
        this.expected = expected;
    }

    public int getFound() {
        return found;
    }

    public int getExpected() {
        return expected;
    }
}
