package com.quicklook.server.flat;

import com.quicklook.server.frame.FrameReader;
import com.quicklook.server.frame.RawFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads one flat-field file per detector from a directory, spreading the files
 * over the worker pool.
 *
 * Files are named {@code <anything>-<detector id>.fits}. The file list is split
 * into {@code numThreads} contiguous groups, one pool task per group. Loaded
 * arrays and the success counter are updated under one lock. The returned
 * future completes once every group has finished, with a set only if every
 * expected file was loaded.
 */
public class FlatLoader {

    private static final Logger logger = LoggerFactory.getLogger(FlatLoader.class);

    static final Pattern FLAT_NAME = Pattern.compile("^.+-(\\d+)\\.fits$");

    private final FrameReader reader;
    private final ExecutorService pool;
    private final int numThreads;

    public FlatLoader(FrameReader reader, ExecutorService pool, int numThreads) {
        if (numThreads <= 0) {
            throw new IllegalArgumentException("numThreads must be positive");
        }
        this.reader = reader;
        this.pool = pool;
        this.numThreads = numThreads;
    }

    /**
     * Starts loading and returns immediately. A wrong number of candidate files
     * yields an already-failed future with {@link CountMismatchException} and
     * no file is read.
     */
    public CompletableFuture<FlatFieldSet> load(Path directory, int expectedCount,
            FlatLoadProgressListener listener) {
        // 1. Enumerate candidates
        Map<Path, Integer> candidates;
        try {
            candidates = findFlatFiles(directory);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new FlatLoadException("Cannot list flat directory " + directory, e));
        }
        if (candidates.size() != expectedCount) {
            logger.error("Flat directory {} has {} files, expected {}", directory, candidates.size(), expectedCount);
            return CompletableFuture.failedFuture(new CountMismatchException(candidates.size(), expectedCount));
        }
        if (candidates.values().stream().distinct().count() != candidates.size()) {
            return CompletableFuture.failedFuture(
                    new FlatLoadException("Duplicate detector ids among flat files in " + directory));
        }

        // 2. Dispatch groups
        List<Path> paths = new ArrayList<>(candidates.keySet());
        List<List<Path>> groups = splitN(paths, numThreads);
        logger.info("Loading {} flats from {} in {} groups", expectedCount, directory, groups.size());

        Map<Integer, double[][]> loaded = new HashMap<>();
        ReentrantLock lock = new ReentrantLock();
        AtomicInteger counter = new AtomicInteger();

        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (List<Path> group : groups) {
            tasks.add(CompletableFuture.runAsync(
                    () -> loadGroup(group, candidates, loaded, lock, counter, expectedCount, listener), pool));
        }

        // 3. Completion is decided once, after every group has finished
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).thenApply(v -> {
            int count = counter.get();
            if (count != expectedCount) {
                throw new CompletionException(new FlatLoadException(
                        "Loaded " + count + " of " + expectedCount + " flats from " + directory));
            }
            Map<Integer, double[][]> snapshot;
            lock.lock();
            try {
                snapshot = new HashMap<>(loaded);
            } finally {
                lock.unlock();
            }
            FlatFieldSet set = new FlatFieldSet(snapshot, expectedCount, count, directory.toString());
            logger.info("Flats loaded: {}", set);
            return set;
        });
    }

    private void loadGroup(List<Path> group, Map<Path, Integer> detectorIds, Map<Integer, double[][]> loaded,
            ReentrantLock lock, AtomicInteger counter, int expectedCount, FlatLoadProgressListener listener) {
        for (Path path : group) {
            int detectorId = detectorIds.get(path);
            try {
                RawFrame raw = reader.read(path);
                int count;
                lock.lock();
                try {
                    loaded.put(detectorId, raw.getPixels());
                    count = counter.incrementAndGet();
                } finally {
                    lock.unlock();
                }
                if (listener != null) {
                    listener.onProgress(count, expectedCount);
                }
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to load flat {} (detector {})", path, detectorId, e);
                if (listener != null) {
                    listener.onFileFailed(path, e);
                }
            }
        }
    }

    /**
     * Flat files in {@code directory} mapped to the detector id in their name,
     * sorted by file name. Files not matching the pattern are ignored.
     */
    public static Map<Path, Integer> findFlatFiles(Path directory) throws IOException {
        Map<Path, Integer> result = new LinkedHashMap<>();
        List<Path> files;
        try (Stream<Path> s = Files.list(directory)) {
            files = s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path p : files) {
            Matcher m = FLAT_NAME.matcher(p.getFileName().toString());
            if (!m.matches()) {
                continue;
            }
            try {
                result.put(p, Integer.parseInt(m.group(1)));
            } catch (NumberFormatException e) {
                logger.warn("Detector id out of range in flat file name {}", p.getFileName());
            }
        }
        return result;
    }

    /**
     * Splits a list into at most {@code n} contiguous groups whose sizes differ
     * by at most one. Empty groups are not returned.
     */
    public static <T> List<List<T>> splitN(List<T> items, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        int groups = Math.min(n, items.size());
        int base = items.size() / groups;
        int rem = items.size() % groups;
        List<List<T>> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < groups; i++) {
            int size = base + (i < rem ? 1 : 0);
            result.add(new ArrayList<>(items.subList(start, start + size)));
            start += size;
        }
        return result;
    }
}
