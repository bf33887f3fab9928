package com.quicklook.server.flat;

public class FlatLoadException extends Exception {

    public FlatLoadException(String message) {
        super(message);
    }

    public FlatLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
