package com.quicklook.server.service;

import com.quicklook.server.OperatorNotifier;
import com.quicklook.server.config.InstrumentConfig;
import com.quicklook.server.config.PipelineSettings;
import com.quicklook.server.config.QuicklookConfig;
import com.quicklook.server.flat.FlatFieldSet;
import com.quicklook.server.flat.FlatLoadProgressListener;
import com.quicklook.server.flat.FlatLoader;
import com.quicklook.server.frame.FitsFrameReader;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active flat-field set.
 *
 * Each load gets a generation number; only the newest load may publish its
 * result, so a slow earlier load can never replace a newer one. Until a load
 * completes the previous set stays in effect.
 */
@Service
public class FlatFieldService {

    private static final Logger logger = LoggerFactory.getLogger(FlatFieldService.class);

    private final FlatLoader loader;
    private final ExecutorService pool;
    private final int expectedCount;
    private final String defaultDirectory;
    private final OperatorNotifier notifier;

    private final AtomicReference<FlatFieldSet> active = new AtomicReference<>(FlatFieldSet.empty());
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger progressLoaded = new AtomicInteger();
    private volatile boolean useFlats;
    private volatile FlatLoadStatus.State state = FlatLoadStatus.State.IDLE;
    private volatile String lastError;
    private volatile String loadingDirectory;

    @Autowired
    public FlatFieldService(QuicklookConfig config, OperatorNotifier notifier) {
        PipelineSettings settings = config.pipeline;
        InstrumentConfig instrument = config.getActiveInstrument();
        this.pool = Executors.newFixedThreadPool(settings.numLoadThreads, r -> {
            Thread t = new Thread(r, "flat-loader");
            t.setDaemon(true);
            return t;
        });
        this.loader = new FlatLoader(new FitsFrameReader(), pool, settings.numLoadThreads);
        this.expectedCount = instrument.numCcds;
        this.defaultDirectory = settings.flatDirectory;
        this.useFlats = settings.useFlats;
        this.notifier = notifier;
    }

    public FlatFieldService(FlatLoader loader, int expectedCount, String defaultDirectory, boolean useFlats,
            OperatorNotifier notifier) {
        this.loader = loader;
        this.pool = null;
        this.expectedCount = expectedCount;
        this.defaultDirectory = defaultDirectory;
        this.useFlats = useFlats;
        this.notifier = notifier;
    }

    /**
     * Starts loading flats from {@code directory} (or the configured one when
     * blank). The returned future completes with the loaded set, whether or not
     * it was published.
     */
    public CompletableFuture<FlatFieldSet> startLoad(String directory) {
        String dir = (directory == null || directory.trim().isEmpty()) ? defaultDirectory : directory.trim();
        if (dir == null || dir.isEmpty()) {
            throw new IllegalArgumentException("No flat directory given or configured");
        }
        Path path = Paths.get(dir);
        long gen = generation.incrementAndGet();
        progressLoaded.set(0);
        state = FlatLoadStatus.State.LOADING;
        loadingDirectory = dir;
        lastError = null;
        notifier.info("Loading flats from " + dir);

        FlatLoadProgressListener listener = new FlatLoadProgressListener() {
            @Override
            public void onProgress(int loaded, int expected) {
                if (generation.get() == gen) {
                    progressLoaded.accumulateAndGet(loaded, Math::max);
                }
            }

            @Override
            public void onFileFailed(Path file, Exception error) {
                notifier.warn("Failed to load flat " + file + ": " + error.getMessage());
            }
        };

        return loader.load(path, expectedCount, listener).whenComplete((set, error) -> {
            if (generation.get() != gen) {
                logger.info("Flat load #{} from {} superseded, result discarded", gen, dir);
                return;
            }
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                lastError = cause.getMessage();
                state = FlatLoadStatus.State.FAILED;
                logger.error("Flat load #{} from {} failed: {}", gen, dir, cause.getMessage());
                notifier.error("Flat load failed: " + cause.getMessage());
                return;
            }
            active.set(set);
            state = FlatLoadStatus.State.COMPLETE;
            logger.info("Flat load #{} published: {}", gen, set);
            notifier.info("Flats loaded.");
        });
    }

    public FlatFieldSet getActiveSet() {
        return active.get();
    }

    public boolean isUseFlats() {
        return useFlats;
    }

    public void setUseFlats(boolean useFlats) {
        this.useFlats = useFlats;
        logger.info("Use flats: {}", useFlats);
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public FlatLoadStatus getStatus() {
        return new FlatLoadStatus(state, generation.get(), progressLoaded.get(), expectedCount, loadingDirectory,
                lastError, useFlats, active.get().getDetectorIds());
    }

    @PreDestroy
    public void shutdown() {
        if (pool == null) {
            return;
        }
        // running loads finish or fail on their own; results are simply not awaited
        pool.shutdown();
        try {
            pool.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
