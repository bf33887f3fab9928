package com.quicklook.server.mosaic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public class ImageGeometry {
    // indexed by channel number - 1
    private final List<ChannelRegion> channels;
    private final int xCut;
    private final int yCut;
    private final int newWidth;
    private final int newHeight;

    public ImageGeometry(List<ChannelRegion> channels, int xCut, int yCut, int newWidth, int newHeight) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
        this.xCut = xCut;
        this.yCut = yCut;
        this.newWidth = newWidth;
        this.newHeight = newHeight;
    }

    public List<ChannelRegion> getChannels() {
        return channels;
    }

    public ChannelRegion getChannel(int channel) {
        return channels.get(channel - 1);
    }

    /**
     * Channels in output (left to right) order.
     */
    public List<ChannelRegion> getChannelsByPosition() {
        List<ChannelRegion> sorted = new ArrayList<>(channels);
        sorted.sort(Comparator.comparingInt(ChannelRegion::getStartPosX));
        return sorted;
    }

    public int getXCut() {
        return xCut;
    }

    public int getYCut() {
        return yCut;
    }

    public int getNewWidth() {
        return newWidth;
    }

    public int getNewHeight() {
        return newHeight;
    }

    @Override
    public String toString() {
        return "ImageGeometry{newWidth=" + newWidth + ", newHeight=" + newHeight + ", xCut=" + xCut + ", yCut="
                + yCut + ", channels=" + channels + "}";
    }
}
