package com.quicklook.server.exposure;

import com.quicklook.server.frame.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exposure in progress. Owned by the tracker and only mutated from the
 * processing tick.
 */
public class ExposureState {
    private final int framesPerExposure;
    private int currentExposureNumber;
    private String currentExposureName;
    private List<Frame> accumulated = new ArrayList<>();

    public ExposureState(int framesPerExposure) {
        this(framesPerExposure, 0);
    }

    public ExposureState(int framesPerExposure, int currentExposureNumber) {
        this.framesPerExposure = framesPerExposure;
        this.currentExposureNumber = currentExposureNumber;
    }

    public int getFramesPerExposure() {
        return framesPerExposure;
    }

    public int getCurrentExposureNumber() {
        return currentExposureNumber;
    }

    public String getCurrentExposureName() {
        return currentExposureName;
    }

    public List<Frame> getAccumulatedFrames() {
        return Collections.unmodifiableList(new ArrayList<>(accumulated));
    }

    public int exposureNumberOf(int frameNumber) {
        return (frameNumber / framesPerExposure) * framesPerExposure;
    }

    // previous list is dropped, not merged
    void startExposure(int exposureNumber, String exposureName, Frame first) {
        this.currentExposureNumber = exposureNumber;
        this.currentExposureName = exposureName;
        this.accumulated = new ArrayList<>();
        this.accumulated.add(first);
    }

    void append(Frame frame, String exposureName) {
        if (currentExposureName == null) {
            currentExposureName = exposureName;
        }
        accumulated.add(frame);
    }
}
