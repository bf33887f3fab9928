package com.quicklook.server.frame;

/**
 * Header keywords and pixel data of one frame file, pixels as [row][col].
 */
public class RawFrame {
    private final Frame frame;
    private final FrameMetadata metadata;
    private final double[][] pixels;

    public RawFrame(Frame frame, FrameMetadata metadata, double[][] pixels) {
        this.frame = frame;
        this.metadata = metadata;
        this.pixels = pixels;
    }

    public Frame getFrame() {
        return frame;
    }

    public FrameMetadata getMetadata() {
        return metadata;
    }

    public double[][] getPixels() {
        return pixels;
    }

    public int getHeight() {
        return pixels.length;
    }

    public int getWidth() {
        return pixels.length == 0 ? 0 : pixels[0].length;
    }
}
