package com.quicklook.server.tools;

import com.quicklook.server.OperatorNotifier;
import com.quicklook.server.config.ConfigResolver;
import com.quicklook.server.config.QuicklookConfig;
import com.quicklook.server.flat.FlatLoader;
import com.quicklook.server.frame.FitsFrameReader;
import com.quicklook.server.frame.Frame;
import com.quicklook.server.mosaic.MosaicTile;
import com.quicklook.server.service.FlatFieldService;
import com.quicklook.server.service.MosaicDisplay;
import com.quicklook.server.service.MosaicPipelineService;
import com.quicklook.server.service.PipelineStatus;
import com.quicklook.server.service.TileSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Offline dry run of the quick-look pipeline over a directory of frames.
 * Frames are replayed in frame-number order, one batch per exposure, and every
 * produced tile is logged. Nothing is written to the catalog.
 * Usage: ExposureReplayTool <frameDir> [flatDir]
 */
public class ExposureReplayTool {

    private static final Logger logger = LoggerFactory.getLogger(ExposureReplayTool.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: ExposureReplayTool <frameDir> [flatDir]");
            System.exit(1);
        }

        File frameDir = new File(args[0]);
        if (!frameDir.isDirectory()) {
            System.err.println("Invalid frame directory: " + args[0]);
            System.exit(1);
        }

        QuicklookConfig config = ConfigResolver.resolve();
        int threads = config.pipeline.numLoadThreads;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            int tiles = replay(config, frameDir.toPath(), args.length > 1 ? args[1] : null, pool);
            logger.info("Replay finished, {} tiles produced", tiles);
        } catch (IOException e) {
            logger.error("Replay of {} failed", frameDir, e);
            System.exit(2);
        } finally {
            pool.shutdownNow();
        }
    }

    static int replay(QuicklookConfig config, Path frameDir, String flatDir, ExecutorService pool)
            throws IOException {
        OperatorNotifier notifier = new LoggingNotifier();
        String flats = flatDir != null ? flatDir : config.pipeline.flatDirectory;
        boolean useFlats = flatDir != null || config.pipeline.useFlats;
        FlatFieldService flatService = new FlatFieldService(
                new FlatLoader(new FitsFrameReader(), pool, config.pipeline.numLoadThreads),
                config.getActiveInstrument().numCcds, flats, useFlats, notifier);

        // 1. Flats, synchronously
        if (useFlats && flats != null && !flats.isEmpty()) {
            try {
                flatService.startLoad(flats).join();
            } catch (CompletionException e) {
                logger.warn("Continuing without flats: {}", e.getCause() == null ? e : e.getCause().getMessage());
            }
        }

        // 2. Group frames by exposure
        Map<Integer, List<String>> byExposure = groupByExposure(frameDir,
                config.getActiveInstrument().framesPerExposure);
        logger.info("Replaying {} exposures from {}", byExposure.size(), frameDir);

        // 3. One batch per exposure, on this thread
        List<TileSummary> summaries = new ArrayList<>();
        MosaicDisplay display = tile -> summaries.add(logTile(tile));
        MosaicPipelineService pipeline = new MosaicPipelineService(config, new FitsFrameReader(), flatService,
                display, notifier, null);
        for (List<String> batch : byExposure.values()) {
            pipeline.processBatch(batch);
        }

        PipelineStatus status = pipeline.getStatus();
        logger.info("Frames failed: {}", status.getFramesFailed());
        return summaries.size();
    }

    static Map<Integer, List<String>> groupByExposure(Path frameDir, int framesPerExposure) throws IOException {
        List<Frame> frames;
        try (Stream<Path> stream = Files.list(frameDir)) {
            frames = stream.filter(Files::isRegularFile)
                    .map(p -> Frame.fromPath(p.toString()))
                    .flatMap(Optional::stream)
                    .sorted((a, b) -> Integer.compare(a.getNumber(), b.getNumber()))
                    .collect(Collectors.toList());
        }
        Map<Integer, List<String>> groups = new LinkedHashMap<>();
        for (Frame f : frames) {
            int exp = (f.getNumber() / framesPerExposure) * framesPerExposure;
            groups.computeIfAbsent(exp, k -> new ArrayList<>()).add(f.getPath());
        }
        return groups;
    }

    private static TileSummary logTile(MosaicTile tile) {
        TileSummary s = new TileSummary(tile);
        logger.info("{} {}x{} detectors={} frames {}-{} flat={} min={} max={} mean={}",
                s.getExposureName(), s.getWidth(), s.getHeight(), s.getDetectorIds(), s.getFirstFrameNumber(),
                s.getLastFrameNumber(), s.isFlatApplied(), s.getMin(), s.getMax(), s.getMean());
        return s;
    }

    private static class LoggingNotifier implements OperatorNotifier {
        @Override
        public void warn(String message) {
            logger.warn(message);
        }

        @Override
        public void error(String message) {
            logger.error(message);
        }

        @Override
        public void info(String message) {
            logger.info(message);
        }
    }
}
