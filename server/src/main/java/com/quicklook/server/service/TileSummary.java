package com.quicklook.server.service;

import com.quicklook.server.mosaic.MosaicTile;
import com.quicklook.util.ArrayMath;

import java.util.List;

public class TileSummary {
    private final String exposureName;
    private final int width;
    private final int height;
    private final List<Integer> detectorIds;
    private final int firstFrameNumber;
    private final int lastFrameNumber;
    private final boolean newExposure;
    private final boolean flatApplied;
    private final double min;
    private final double max;
    private final double mean;
    private final long createdTs;

    public TileSummary(MosaicTile tile) {
        this.exposureName = tile.getExposureName();
        this.width = tile.getWidth();
        this.height = tile.getHeight();
        this.detectorIds = tile.getDetectorIds();
        this.firstFrameNumber = tile.getFirstFrameNumber();
        this.lastFrameNumber = tile.getLastFrameNumber();
        this.newExposure = tile.isNewExposure();
        this.flatApplied = tile.isFlatApplied();
        double[] stats = ArrayMath.stats(tile.getData());
        this.min = stats[0];
        this.max = stats[1];
        this.mean = stats[2];
        this.createdTs = tile.getCreatedTs();
    }

    public String getExposureName() {
        return exposureName;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<Integer> getDetectorIds() {
        return detectorIds;
    }

    public int getFirstFrameNumber() {
        return firstFrameNumber;
    }

    public int getLastFrameNumber() {
        return lastFrameNumber;
    }

    public boolean isNewExposure() {
        return newExposure;
    }

    public boolean isFlatApplied() {
        return flatApplied;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public long getCreatedTs() {
        return createdTs;
    }
}
