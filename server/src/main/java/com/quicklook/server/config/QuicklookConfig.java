package com.quicklook.server.config;

import java.util.ArrayList;
import java.util.List;

public class QuicklookConfig {
    public String activeInstrument = "SPCAM";
    public PipelineSettings pipeline = new PipelineSettings();
    public List<InstrumentConfig> instruments = new ArrayList<>();

    /**
     * Returns the instrument selected by {@link #activeInstrument}, falling back
     * to the built-in SPCAM constants when no instruments are configured at all.
     */
    public InstrumentConfig getActiveInstrument() {
        if (instruments == null || instruments.isEmpty()) {
            return InstrumentConfig.spcam();
        }
        for (InstrumentConfig ic : instruments) {
            if (ic.name != null && ic.name.equalsIgnoreCase(activeInstrument)) {
                return ic;
            }
        }
        throw new ConfigurationException("Unknown active instrument: " + activeInstrument);
    }

    public void validate() {
        if (pipeline == null) {
            pipeline = new PipelineSettings();
        }
        pipeline.validate();
        getActiveInstrument().validate();
    }
}
