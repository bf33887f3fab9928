package com.quicklook.server.flat;

public class FlatApplication {
    private final double[][] data;
    private final boolean applied;

    public FlatApplication(double[][] data, boolean applied) {
        this.data = data;
        this.applied = applied;
    }

    public double[][] getData() {
        return data;
    }

    public boolean isApplied() {
        return applied;
    }
}
