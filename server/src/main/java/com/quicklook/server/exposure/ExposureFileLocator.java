package com.quicklook.server.exposure;

import com.quicklook.server.config.InstrumentConfig;
import com.quicklook.server.frame.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the on-disk frames of one exposure in a data directory.
 */
public class ExposureFileLocator {

    private static final Logger logger = LoggerFactory.getLogger(ExposureFileLocator.class);

    private final InstrumentConfig instrument;

    public ExposureFileLocator(InstrumentConfig instrument) {
        this.instrument = instrument;
    }

    /**
     * Lists {@code <frameId>.fits} for every frame number of the exposure that
     * contains {@code frameId}. Missing frames are skipped.
     */
    public List<String> listExposureFiles(Path dataDirectory, String frameId) {
        Optional<Frame> parsed = Frame.fromFrameId(frameId.trim());
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("Not a frame id: '" + frameId + "'");
        }
        Frame frame = parsed.get();
        if (!instrument.inscode.equals(frame.getInscode())) {
            throw new IllegalArgumentException(
                    "Frame " + frame + " does not belong to " + instrument.name + " (" + instrument.inscode + ")");
        }
        int fpe = instrument.framesPerExposure;
        int expNum = (frame.getNumber() / fpe) * fpe;

        List<String> paths = new ArrayList<>();
        for (int i = 0; i < fpe; i++) {
            Path candidate = dataDirectory.resolve(frame.withNumber(expNum + i).getFrameId() + ".fits");
            if (Files.isRegularFile(candidate)) {
                paths.add(candidate.toString());
            }
        }
        logger.info("Exposure {} has {} of {} frames in {}", frame.withNumber(expNum), paths.size(), fpe,
                dataDirectory);
        return paths;
    }
}
