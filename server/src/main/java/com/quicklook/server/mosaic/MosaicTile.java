package com.quicklook.server.mosaic;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Corrected, stitched output for (part of) one exposure, handed to the display.
 */
public class MosaicTile {
    private final String exposureName;
    private final double[][] data;
    private final Map<String, Object> metadata;
    private final List<Integer> detectorIds;
    private final int firstFrameNumber;
    private final int lastFrameNumber;
    private final boolean newExposure;
    private final boolean flatApplied;
    private final long createdTs;

    public MosaicTile(String exposureName, double[][] data, Map<String, Object> metadata, List<Integer> detectorIds,
            int firstFrameNumber, int lastFrameNumber, boolean newExposure, boolean flatApplied) {
        this.exposureName = exposureName;
        this.data = data;
        this.metadata = Collections.unmodifiableMap(metadata);
        this.detectorIds = Collections.unmodifiableList(detectorIds);
        this.firstFrameNumber = firstFrameNumber;
        this.lastFrameNumber = lastFrameNumber;
        this.newExposure = newExposure;
        this.flatApplied = flatApplied;
        this.createdTs = System.currentTimeMillis();
    }

    public String getExposureName() {
        return exposureName;
    }

    public double[][] getData() {
        return data;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
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

    public long getCreatedTs() {
        return createdTs;
    }

    public int getWidth() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public int getHeight() {
        return data.length;
    }

    @Override
    public String toString() {
        return "MosaicTile{exposure='" + exposureName + "', " + getWidth() + "x" + getHeight() + ", detectors="
                + detectorIds + ", frames=" + firstFrameNumber + ".." + lastFrameNumber + ", new=" + newExposure
                + "}";
    }
}
