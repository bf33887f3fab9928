package com.quicklook.server.service;

import com.quicklook.db.ExposureCatalogDao;
import com.quicklook.db.ExposureRecord;
import com.quicklook.db.MosaicTileDao;
import com.quicklook.db.SqliteInitializer;
import com.quicklook.server.OperatorNotifier;
import com.quicklook.server.config.ConfigResolver;
import com.quicklook.server.config.InstrumentConfig;
import com.quicklook.server.config.PipelineSettings;
import com.quicklook.server.config.QuicklookConfig;
import com.quicklook.server.exposure.BatchClassification;
import com.quicklook.server.exposure.ExposureFileLocator;
import com.quicklook.server.exposure.ExposureState;
import com.quicklook.server.exposure.ExposureTracker;
import com.quicklook.server.flat.FlatApplication;
import com.quicklook.server.flat.FlatFieldApplier;
import com.quicklook.server.frame.FitsFrameReader;
import com.quicklook.server.frame.Frame;
import com.quicklook.server.frame.FrameReader;
import com.quicklook.server.frame.RawFrame;
import com.quicklook.server.ingest.IngestionQueue;
import com.quicklook.server.mosaic.CorrectedFrame;
import com.quicklook.server.mosaic.CorrectionResult;
import com.quicklook.server.mosaic.FrameOutcome;
import com.quicklook.server.mosaic.ImageGeometry;
import com.quicklook.server.mosaic.MalformedMetadataException;
import com.quicklook.server.mosaic.MosaicAssembler;
import com.quicklook.server.mosaic.MosaicTile;
import com.quicklook.server.mosaic.OverscanCorrector;
import com.quicklook.server.mosaic.RegionExtractor;
import com.quicklook.server.mosaic.RegionMismatchException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Online quick-look pipeline: arriving frame paths are debounced, grouped into
 * exposures, bias corrected, flat fielded and handed to the display.
 *
 * All frame processing and all exposure state live on the ingestion queue's
 * tick thread.
 */
@Service
public class MosaicPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(MosaicPipelineService.class);

    private final InstrumentConfig instrument;
    private final PipelineSettings settings;
    private final FrameReader reader;
    private final FlatFieldService flatService;
    private final MosaicDisplay display;
    private final OperatorNotifier notifier;
    private final String catalogDbPath;

    private final ExposureTracker tracker;
    private final ExposureFileLocator locator;
    private final RegionExtractor extractor;
    private final OverscanCorrector corrector = new OverscanCorrector();
    private final MosaicAssembler assembler = new MosaicAssembler();
    private final FlatFieldApplier flatApplier;

    private IngestionQueue queue;
    private ExposureCatalogDao exposureDao;
    private MosaicTileDao tileDao;

    private volatile boolean subtractBias;
    // written at the end of each tick for status readers
    private volatile int lastExposureNumber;
    private volatile String lastExposureName;
    private volatile int lastAccumulated;
    private final AtomicLong tilesProduced = new AtomicLong();
    private final AtomicLong framesFailed = new AtomicLong();

    @Autowired
    public MosaicPipelineService(QuicklookConfig config, FlatFieldService flatService, MosaicDisplay display,
            OperatorNotifier notifier) {
        this(config, new FitsFrameReader(), flatService, display, notifier,
                ConfigResolver.resolveCatalogDbPath(config.pipeline));
    }

    public MosaicPipelineService(QuicklookConfig config, FrameReader reader, FlatFieldService flatService,
            MosaicDisplay display, OperatorNotifier notifier, String catalogDbPath) {
        this.instrument = config.getActiveInstrument();
        this.settings = config.pipeline;
        this.reader = reader;
        this.flatService = flatService;
        this.display = display;
        this.notifier = notifier;
        this.catalogDbPath = catalogDbPath;
        this.tracker = new ExposureTracker(instrument);
        this.locator = new ExposureFileLocator(instrument);
        this.extractor = new RegionExtractor(instrument.keywordPrefix);
        this.flatApplier = new FlatFieldApplier(notifier);
        this.subtractBias = settings.subtractBias;
    }

    @PostConstruct
    public void start() {
        logger.info("Starting quick-look pipeline for {}", instrument);
        if (catalogDbPath != null) {
            try {
                SqliteInitializer.initialize(catalogDbPath);
                exposureDao = new ExposureCatalogDao(catalogDbPath);
                tileDao = new MosaicTileDao(catalogDbPath);
                logger.info("Initialized SQLite catalog at {}", catalogDbPath);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite catalog at {}, catalog disabled", catalogDbPath, e);
            }
        }
        queue = new IngestionQueue(this::processBatch, settings.debounceMillis(), settings.maxBatchWaitMillis());
    }

    @PreDestroy
    public void stop() {
        if (queue != null) {
            queue.stop();
        }
    }

    public void notifyFile(String path) {
        queue.notifyFile(path);
    }

    public void dropFiles(Collection<String> paths) {
        logger.info("files dropped: {}", paths);
        queue.notifyFiles(paths);
    }

    /**
     * Loads every on-disk frame of the exposure containing {@code frameId} and
     * mosaics it as a new image. Returns the paths found; processing happens on
     * the tick thread.
     */
    public List<String> loadExposure(String frameId) {
        List<String> paths = locator.listExposureFiles(Paths.get(settings.dataDirectory), frameId);
        if (paths.isEmpty()) {
            return paths;
        }
        queue.execute(() -> {
            BatchClassification classification = tracker.classify(paths);
            recordExposures(classification.getExposuresSeen());
            List<Frame> frames = new ArrayList<>();
            for (String p : paths) {
                Frame.fromPath(p).ifPresent(frames::add);
            }
            String name = frames.get(0).withNumber(
                    tracker.getState().exposureNumberOf(frames.get(0).getNumber())).getFrameId();
            processFrames(name, frames, true);
            publishState();
        });
        return paths;
    }

    /**
     * Tick handler: one call per debounced batch. Offline replays call it
     * directly from their single thread.
     */
    public void processBatch(List<String> paths) {
        BatchClassification classification = tracker.classify(paths);
        recordExposures(classification.getExposuresSeen());
        if (!classification.isEmpty()) {
            logger.info("Mosaicing {} frames of {} (new exposure: {})", classification.getAcceptedFrames().size(),
                    classification.getExposureName(), classification.isNewExposure());
            processFrames(classification.getExposureName(), classification.getAcceptedFrames(),
                    classification.isNewExposure());
        }
        publishState();
    }

    private void processFrames(String exposureName, List<Frame> frames, boolean newExposure) {
        List<CorrectedFrame> corrected = new ArrayList<>();
        for (Frame frame : frames) {
            FrameOutcome outcome = processFrame(frame);
            if (outcome.isSuccess()) {
                corrected.add(outcome.getCorrected());
            } else {
                framesFailed.incrementAndGet();
                String msg = "Frame " + outcome.getFrame() + " dropped: " + outcome.getError().getMessage();
                logger.warn(msg);
                notifier.warn(msg);
            }
        }

        List<MosaicTile> tiles = assembler.assemble(exposureName, corrected, newExposure, instrument.tileOffsets);
        for (MosaicTile tile : tiles) {
            display.setCurrentImage(tile);
            tilesProduced.incrementAndGet();
            recordTile(tile);
        }
    }

    FrameOutcome processFrame(Frame frame) {
        try {
            RawFrame raw = reader.read(Paths.get(frame.getPath()));
            Frame identified = frame.withDetectorId(raw.getMetadata().getDetectorId());

            ImageGeometry geometry = extractor.extract(raw.getMetadata());
            CorrectionResult result = corrector.correct(raw.getPixels(), geometry, instrument.keywordPrefix,
                    subtractBias);

            Map<String, Object> metadata = new LinkedHashMap<>(raw.getMetadata().asMap());
            metadata.putAll(result.getHeaderUpdates());

            FlatApplication flat = flatApplier.apply(result.getData(), identified.getDetectorId(),
                    flatService.getActiveSet(), flatService.isUseFlats());
            return FrameOutcome.success(new CorrectedFrame(identified, flat.getData(), metadata, flat.isApplied()));
        } catch (IOException | MalformedMetadataException | RegionMismatchException e) {
            return FrameOutcome.failure(frame, e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}", frame, e);
            return FrameOutcome.failure(frame, e);
        }
    }

    private void recordExposures(Map<String, Set<String>> exposuresSeen) {
        if (exposureDao == null) {
            return;
        }
        for (Map.Entry<String, Set<String>> e : exposuresSeen.entrySet()) {
            Optional<Frame> id = Frame.fromFrameId(e.getKey());
            if (id.isEmpty() || e.getValue().isEmpty()) {
                continue;
            }
            try {
                ExposureRecord record = exposureDao.getOrCreate(e.getKey(), id.get().getNumber(),
                        e.getValue().iterator().next());
                for (String path : e.getValue()) {
                    exposureDao.addFrame(record.getId(), path);
                }
            } catch (SQLException ex) {
                logger.error("Failed to record exposure {} in catalog", e.getKey(), ex);
            }
        }
    }

    private void recordTile(MosaicTile tile) {
        if (tileDao == null) {
            return;
        }
        String detectors = tile.getDetectorIds().stream().map(String::valueOf).collect(Collectors.joining(","));
        try {
            tileDao.insert(tile.getExposureName(), detectors, tile.getFirstFrameNumber(), tile.getLastFrameNumber(),
                    tile.getWidth(), tile.getHeight(), tile.isFlatApplied());
        } catch (SQLException e) {
            logger.error("Failed to record tile of {} in catalog", tile.getExposureName(), e);
        }
    }

    private void publishState() {
        ExposureState state = tracker.getState();
        lastExposureNumber = state.getCurrentExposureNumber();
        lastExposureName = state.getCurrentExposureName();
        lastAccumulated = state.getAccumulatedFrames().size();
    }

    public List<ExposureRecord> listExposures(int limit) {
        if (exposureDao == null) {
            return Collections.emptyList();
        }
        try {
            return exposureDao.listRecent(limit);
        } catch (SQLException e) {
            logger.error("Failed to list exposures", e);
            return Collections.emptyList();
        }
    }

    public void setSubtractBias(boolean subtractBias) {
        this.subtractBias = subtractBias;
        logger.info("Subtract bias: {}", subtractBias);
    }

    public boolean isSubtractBias() {
        return subtractBias;
    }

    /**
     * Runs an action after everything queued on the tick thread so far.
     */
    Future<?> runOnTickThread(Runnable action) {
        return queue.execute(action);
    }

    public PipelineStatus getStatus() {
        return new PipelineStatus(instrument.name, lastExposureNumber, lastExposureName, lastAccumulated,
                queue == null ? 0 : queue.pendingCount(), queue == null ? 0 : queue.tickCount(),
                tilesProduced.get(), framesFailed.get(), subtractBias, flatService.isUseFlats(), exposureDao != null);
    }
}
