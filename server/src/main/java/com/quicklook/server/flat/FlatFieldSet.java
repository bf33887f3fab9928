package com.quicklook.server.flat;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Flat-field arrays keyed by detector id. Instances are immutable and only
 * created once every expected file has been loaded.
 */
public class FlatFieldSet {
    private final Map<Integer, double[][]> flats;
    private final int expectedCount;
    private final int loadedCount;
    private final String sourceDirectory;

    public FlatFieldSet(Map<Integer, double[][]> flats, int expectedCount, int loadedCount, String sourceDirectory) {
        this.flats = Collections.unmodifiableMap(new TreeMap<>(flats));
        this.expectedCount = expectedCount;
        this.loadedCount = loadedCount;
        this.sourceDirectory = sourceDirectory;
    }

    public static FlatFieldSet empty() {
        return new FlatFieldSet(Collections.emptyMap(), 0, 0, null);
    }

    public boolean contains(int detectorId) {
        return flats.containsKey(detectorId);
    }

    public double[][] get(int detectorId) {
        return flats.get(detectorId);
    }

    public Set<Integer> getDetectorIds() {
        return Collections.unmodifiableSet(new TreeSet<>(flats.keySet()));
    }

    public int size() {
        return flats.size();
    }

    public boolean isEmpty() {
        return flats.isEmpty();
    }

    public boolean isComplete() {
        return expectedCount > 0 && loadedCount == expectedCount;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public int getLoadedCount() {
        return loadedCount;
    }

    public String getSourceDirectory() {
        return sourceDirectory;
    }

    @Override
    public String toString() {
        return "FlatFieldSet{detectors=" + flats.keySet() + ", loaded=" + loadedCount + "/" + expectedCount
                + ", dir='" + sourceDirectory + "'}";
    }
}
