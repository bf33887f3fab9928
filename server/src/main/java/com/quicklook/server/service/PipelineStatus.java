package com.quicklook.server.service;

public class PipelineStatus {
    private final String instrument;
    private final int currentExposureNumber;
    private final String currentExposureName;
    private final int accumulatedFrames;
    private final int pendingPaths;
    private final long ticks;
    private final long tilesProduced;
    private final long framesFailed;
    private final boolean subtractBias;
    private final boolean useFlats;
    private final boolean catalogEnabled;

    public PipelineStatus(String instrument, int currentExposureNumber, String currentExposureName,
            int accumulatedFrames, int pendingPaths, long ticks, long tilesProduced, long framesFailed,
            boolean subtractBias, boolean useFlats, boolean catalogEnabled) {
        this.instrument = instrument;
        this.currentExposureNumber = currentExposureNumber;
        this.currentExposureName = currentExposureName;
        this.accumulatedFrames = accumulatedFrames;
        this.pendingPaths = pendingPaths;
        this.ticks = ticks;
        this.tilesProduced = tilesProduced;
        this.framesFailed = framesFailed;
        this.subtractBias = subtractBias;
        this.useFlats = useFlats;
        this.catalogEnabled = catalogEnabled;
    }

    public String getInstrument() {
        return instrument;
    }

    public int getCurrentExposureNumber() {
        return currentExposureNumber;
    }

    public String getCurrentExposureName() {
        return currentExposureName;
    }

    public int getAccumulatedFrames() {
        return accumulatedFrames;
    }

    public int getPendingPaths() {
        return pendingPaths;
    }

    public long getTicks() {
        return ticks;
    }

    public long getTilesProduced() {
        return tilesProduced;
    }

    public long getFramesFailed() {
        return framesFailed;
    }

    public boolean isSubtractBias() {
        return subtractBias;
    }

    public boolean isUseFlats() {
        return useFlats;
    }

    public boolean isCatalogEnabled() {
        return catalogEnabled;
    }
}
