package com.quicklook.server.exposure;

import com.quicklook.server.frame.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class BatchClassification {
    private final List<Frame> acceptedFrames;
    private final boolean newExposure;
    private final String exposureName;
    // exposure name -> paths seen in this batch, stale frames included
    private final Map<String, Set<String>> exposuresSeen;

    public BatchClassification(List<Frame> acceptedFrames, boolean newExposure, String exposureName,
            Map<String, Set<String>> exposuresSeen) {
        this.acceptedFrames = Collections.unmodifiableList(new ArrayList<>(acceptedFrames));
        this.newExposure = newExposure;
        this.exposureName = exposureName;
        this.exposuresSeen = Collections.unmodifiableMap(new LinkedHashMap<>(exposuresSeen));
    }

    public List<Frame> getAcceptedFrames() {
        return acceptedFrames;
    }

    public List<String> getAcceptedPaths() {
        List<String> paths = new ArrayList<>();
        for (Frame f : acceptedFrames) {
            paths.add(f.getPath());
        }
        return paths;
    }

    public boolean isNewExposure() {
        return newExposure;
    }

    public String getExposureName() {
        return exposureName;
    }

    public Map<String, Set<String>> getExposuresSeen() {
        return exposuresSeen;
    }

    public boolean isEmpty() {
        return acceptedFrames.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchClassification{accepted=" + acceptedFrames.size() + ", newExposure=" + newExposure
                + ", exposure='" + exposureName + "', exposuresSeen=" + exposuresSeen.keySet() + "}";
    }
}
