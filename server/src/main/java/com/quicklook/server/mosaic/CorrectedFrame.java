package com.quicklook.server.mosaic;

import com.quicklook.server.frame.Frame;

import java.util.Map;

/**
 * One frame after overscan correction (and flat fielding when applied).
 */
public class CorrectedFrame {
    private final Frame frame;
    private final double[][] data;
    private final Map<String, Object> metadata;
    private final boolean flatApplied;

    public CorrectedFrame(Frame frame, double[][] data, Map<String, Object> metadata, boolean flatApplied) {
        this.frame = frame;
        this.data = data;
        this.metadata = metadata;
        this.flatApplied = flatApplied;
    }

    public Frame getFrame() {
        return frame;
    }

    public double[][] getData() {
        return data;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isFlatApplied() {
        return flatApplied;
    }

    public int getHeight() {
        return data.length;
    }

    public int getWidth() {
        return data.length == 0 ? 0 : data[0].length;
    }
}
