package com.quicklook.server.mosaic;

import java.util.Map;

public class CorrectionResult {
    private final double[][] data;
    // keywords to overwrite in the output header
    private final Map<String, Object> headerUpdates;
    private final boolean biasSubtracted;

    public CorrectionResult(double[][] data, Map<String, Object> headerUpdates, boolean biasSubtracted) {
        this.data = data;
        this.headerUpdates = headerUpdates;
        this.biasSubtracted = biasSubtracted;
    }

    public double[][] getData() {
        return data;
    }

    public Map<String, Object> getHeaderUpdates() {
        return headerUpdates;
    }

    public boolean isBiasSubtracted() {
        return biasSubtracted;
    }
}
