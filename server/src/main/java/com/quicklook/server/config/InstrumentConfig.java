package com.quicklook.server.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-instrument constants. Camera variants differ only in these values.
 */
public class InstrumentConfig {
    public String name = "SPCAM";
    public String inscode = "SUP";
    public String keywordPrefix = "S";
    public int framesPerExposure = 10;
    public int numCcds = 10;
    public double fovDeg = 0.72;
    // detector id -> offset; empty means each frame is its own tile
    public Map<Integer, TileOffset> tileOffsets = new HashMap<>();

    public InstrumentConfig() {
    }

    public InstrumentConfig(String name, String inscode, String keywordPrefix, int framesPerExposure, int numCcds,
            double fovDeg) {
        this.name = name;
        this.inscode = inscode;
        this.keywordPrefix = keywordPrefix;
        this.framesPerExposure = framesPerExposure;
        this.numCcds = numCcds;
        this.fovDeg = fovDeg;
    }

    public static InstrumentConfig spcam() {
        return new InstrumentConfig("SPCAM", "SUP", "S", 10, 10, 0.72);
    }

    public void validate() {
        if (keywordPrefix == null || !keywordPrefix.matches("[A-Z0-9]+")) {
            throw new ConfigurationException(
                    "Instrument " + name + ": invalid keyword prefix '" + keywordPrefix + "'");
        }
        if (inscode == null || !inscode.matches("[A-Z]{3}")) {
            throw new ConfigurationException("Instrument " + name + ": invalid inscode '" + inscode + "'");
        }
        if (framesPerExposure <= 0) {
            throw new ConfigurationException(
                    "Instrument " + name + ": framesPerExposure must be positive, got " + framesPerExposure);
        }
        if (numCcds <= 0) {
            throw new ConfigurationException("Instrument " + name + ": numCcds must be positive, got " + numCcds);
        }
    }

    @Override
    public String toString() {
        return "InstrumentConfig{name='" + name + "', inscode='" + inscode + "', prefix='" + keywordPrefix
                + "', framesPerExposure=" + framesPerExposure + ", numCcds=" + numCcds + "}";
    }
}
