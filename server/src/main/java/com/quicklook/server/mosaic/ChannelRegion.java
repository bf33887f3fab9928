package com.quicklook.server.mosaic;

/**
 * Effective-pixel and overscan bounds of one readout channel, 0-based and
 * inclusive, plus the channel's column offset in the trimmed output.
 */
public class ChannelRegion {
    private final int channel;
    private final int efMinX;
    private final int efMaxX;
    private final int efMinY;
    private final int efMaxY;
    private final int osMinX;
    private final int osMaxX;
    private final int osMinY;
    private final int osMaxY;
    private final double gain;
    private int startPosX;

    public ChannelRegion(int channel, int efMinX, int efMaxX, int efMinY, int efMaxY,
            int osMinX, int osMaxX, int osMinY, int osMaxY, double gain) {
        this.channel = channel;
        this.efMinX = efMinX;
        this.efMaxX = efMaxX;
        this.efMinY = efMinY;
        this.efMaxY = efMaxY;
        this.osMinX = osMinX;
        this.osMaxX = osMaxX;
        this.osMinY = osMinY;
        this.osMaxY = osMaxY;
        this.gain = gain;
    }

    public int getChannel() {
        return channel;
    }

    public int getEfMinX() {
        return efMinX;
    }

    public int getEfMaxX() {
        return efMaxX;
    }

    public int getEfMinY() {
        return efMinY;
    }

    public int getEfMaxY() {
        return efMaxY;
    }

    public int getOsMinX() {
        return osMinX;
    }

    public int getOsMaxX() {
        return osMaxX;
    }

    public int getOsMinY() {
        return osMinY;
    }

    public int getOsMaxY() {
        return osMaxY;
    }

    public double getGain() {
        return gain;
    }

    public int getStartPosX() {
        return startPosX;
    }

    // assigned once by RegionExtractor after sorting
    void setStartPosX(int startPosX) {
        this.startPosX = startPosX;
    }

    public int getEffectiveWidth() {
        return efMaxX - efMinX + 1;
    }

    public int getEffectiveHeight() {
        return efMaxY - efMinY + 1;
    }

    public int getOverscanWidth() {
        return osMaxX - osMinX + 1;
    }

    public int getOverscanHeight() {
        return osMaxY - osMinY + 1;
    }

    @Override
    public String toString() {
        return "ChannelRegion{ch=" + channel + ", ef=[" + efMinX + ".." + efMaxX + "]x[" + efMinY + ".." + efMaxY
                + "], os=[" + osMinX + ".." + osMaxX + "]x[" + osMinY + ".." + osMaxY + "], gain=" + gain
                + ", startPosX=" + startPosX + "}";
    }
}
