package com.quicklook.server.service;

import java.util.Set;

public class FlatLoadStatus {

    public enum State {
        IDLE, LOADING, COMPLETE, FAILED
    }

    private final State state;
    private final long generation;
    private final int loaded;
    private final int expected;
    private final String directory;
    private final String lastError;
    private final boolean useFlats;
    private final Set<Integer> activeDetectorIds;

    public FlatLoadStatus(State state, long generation, int loaded, int expected, String directory,
            String lastError, boolean useFlats, Set<Integer> activeDetectorIds) {
        this.state = state;
        this.generation = generation;
        this.loaded = loaded;
        this.expected = expected;
        this.directory = directory;
        this.lastError = lastError;
        this.useFlats = useFlats;
        this.activeDetectorIds = activeDetectorIds;
    }

    public State getState() {
        return state;
    }

    public long getGeneration() {
        return generation;
    }

    public int getLoaded() {
        return loaded;
    }

    public int getExpected() {
        return expected;
    }

    public double getProgress() {
        return expected <= 0 ? 0.0 : (double) loaded / expected;
    }

    public String getDirectory() {
        return directory;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isUseFlats() {
        return useFlats;
    }

    public Set<Integer> getActiveDetectorIds() {
        return activeDetectorIds;
    }
}
