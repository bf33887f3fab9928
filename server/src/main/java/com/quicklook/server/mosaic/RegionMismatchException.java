package com.quicklook.server.mosaic;

/**
 * Header geometry does not agree with the pixel data of a channel.
 */
public class RegionMismatchException extends Exception {

    private final int channel;

    public RegionMismatchException(int channel, String message) {
        super(message);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }
}
