package com.quicklook.server.config;

public class PipelineSettings {
    public double debounceIntervalSeconds = 0.2;
    // upper bound on how long a steady stream of notifications can hold back a batch
    public double maxBatchWaitSeconds = 2.0;
    public boolean useFlats = false;
    public String flatDirectory = "";
    public int numLoadThreads = 4;
    public boolean subtractBias = true;
    public String dataDirectory = ".";
    public String catalogDbPath;

    public long debounceMillis() {
        return Math.round(debounceIntervalSeconds * 1000.0);
    }

    public long maxBatchWaitMillis() {
        return Math.round(maxBatchWaitSeconds * 1000.0);
    }

    public void validate() {
        if (debounceIntervalSeconds <= 0) {
            throw new ConfigurationException(
                    "debounceIntervalSeconds must be positive, got " + debounceIntervalSeconds);
        }
        if (maxBatchWaitSeconds < debounceIntervalSeconds) {
            throw new ConfigurationException("maxBatchWaitSeconds (" + maxBatchWaitSeconds
                    + ") must not be shorter than debounceIntervalSeconds (" + debounceIntervalSeconds + ")");
        }
        if (numLoadThreads <= 0) {
            throw new ConfigurationException("numLoadThreads must be positive, got " + numLoadThreads);
        }
    }
}
