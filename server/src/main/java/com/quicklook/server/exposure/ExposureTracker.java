package com.quicklook.server.exposure;

import com.quicklook.server.config.InstrumentConfig;
import com.quicklook.server.frame.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which arriving frames belong to the exposure being built.
 *
 * Frames of another instrument and frames numbered below the current exposure
 * are dropped. A frame whose exposure number is above the current one starts a
 * new exposure and abandons whatever was accumulated for the old one; no result
 * is ever produced for an abandoned exposure.
 */
public class ExposureTracker {

    private static final Logger logger = LoggerFactory.getLogger(ExposureTracker.class);

    private final InstrumentConfig instrument;
    private final ExposureState state;

    public ExposureTracker(InstrumentConfig instrument) {
        this(instrument, new ExposureState(instrument.framesPerExposure));
    }

    public ExposureTracker(InstrumentConfig instrument, ExposureState state) {
        this.instrument = instrument;
        this.state = state;
    }

    public ExposureState getState() {
        return state;
    }

    public BatchClassification classify(List<String> batch) {
        List<Frame> accepted = new ArrayList<>();
        boolean newExposure = false;
        String exposureName = state.getCurrentExposureName();
        Map<String, Set<String>> exposuresSeen = new LinkedHashMap<>();

        for (String path : batch) {
            Optional<Frame> parsed = Frame.fromPath(path);
            if (parsed.isEmpty()) {
                logger.debug("Not a frame file, dropped: {}", path);
                continue;
            }
            Frame frame = parsed.get();
            // not an instrument frame
            if (!instrument.inscode.equals(frame.getInscode())) {
                logger.debug("Frame {} is not from {}, dropped", frame, instrument.inscode);
                continue;
            }

            int expNum = state.exposureNumberOf(frame.getNumber());
            String expName = frame.withNumber(expNum).getFrameId();
            exposuresSeen.computeIfAbsent(expName, k -> new LinkedHashSet<>()).add(path);

            if (frame.getNumber() < state.getCurrentExposureNumber()) {
                logger.debug("Frame {} older than current exposure {}, dropped", frame,
                        state.getCurrentExposureNumber());
                continue;
            }

            if (expNum > state.getCurrentExposureNumber()) {
                if (!state.getAccumulatedFrames().isEmpty()) {
                    logger.info("Exposure {} abandoned with {} frames, superseded by {}",
                            state.getCurrentExposureName(), state.getAccumulatedFrames().size(), expName);
                }
                state.startExposure(expNum, expName, frame);
                accepted = new ArrayList<>();
                accepted.add(frame);
                newExposure = true;
                exposureName = expName;
            } else {
                state.append(frame, expName);
                accepted.add(frame);
                if (exposureName == null) {
                    exposureName = expName;
                }
            }
        }

        BatchClassification result = new BatchClassification(accepted, newExposure, exposureName, exposuresSeen);
        logger.debug("Classified batch of {}: {}", batch.size(), result);
        return result;
    }
}
