package com.quicklook.db;

public class MosaicTileRecord {
    private final long id;
    private final String exposureName;
    private final String detectorIds;
    private final int frameFirst;
    private final int frameLast;
    private final int width;
    private final int height;
    private final boolean flatApplied;
    private final long createdTs;

    public MosaicTileRecord(long id, String exposureName, String detectorIds, int frameFirst, int frameLast,
            int width, int height, boolean flatApplied, long createdTs) {
        this.id = id;
        this.exposureName = exposureName;
        this.detectorIds = detectorIds;
        this.frameFirst = frameFirst;
        this.frameLast = frameLast;
        this.width = width;
        this.height = height;
        this.flatApplied = flatApplied;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getExposureName() {
        return exposureName;
    }

    // comma separated
    public String getDetectorIds() {
        return detectorIds;
    }

    public int getFrameFirst() {
        return frameFirst;
    }

    public int getFrameLast() {
        return frameLast;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isFlatApplied() {
        return flatApplied;
    }

    public long getCreatedTs() {
        return createdTs;
    }
}
