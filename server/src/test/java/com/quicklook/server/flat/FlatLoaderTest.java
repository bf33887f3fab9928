package com.quicklook.server.flat;

import com.quicklook.server.frame.Frame;
import com.quicklook.server.frame.FrameMetadata;
import com.quicklook.server.frame.FrameReader;
import com.quicklook.server.frame.RawFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FlatLoaderTest {

    @TempDir
    Path flatDir;

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    public void teardown() {
        pool.shutdownNow();
    }

    /**
     * Serves a 2x2 array filled with the detector id parsed from the name.
     */
    private static class CountingReader implements FrameReader {
        final AtomicInteger reads = new AtomicInteger();
        final String failOn;

        CountingReader(String failOn) {
            this.failOn = failOn;
        }

        @Override
        public RawFrame read(Path path) throws IOException {
            reads.incrementAndGet();
            String name = path.getFileName().toString();
            if (failOn != null && name.equals(failOn)) {
                throw new IOException("corrupt " + name);
            }
            int id = Integer.parseInt(name.substring(name.lastIndexOf('-') + 1, name.indexOf(".fits")));
            double[][] px = { { id, id }, { id, id } };
            return new RawFrame(new Frame(path.toString(), "", ' ', -1, id), new FrameMetadata(Collections.emptyMap()),
                    px);
        }
    }

    private void createFlats(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            Files.createFile(flatDir.resolve("domeflat-" + i + ".fits"));
        }
        Files.createFile(flatDir.resolve("README.txt"));
    }

    @Test
    public void testLoadsEveryDetector() throws Exception {
        createFlats(10);
        CountingReader reader = new CountingReader(null);
        List<Integer> progress = new CopyOnWriteArrayList<>();
        FlatLoader loader = new FlatLoader(reader, pool, 4);

        FlatFieldSet set = loader.load(flatDir, 10, (loaded, expected) -> progress.add(loaded))
                .get(10, TimeUnit.SECONDS);

        assertEquals(10, set.size());
        assertTrue(set.isComplete());
        for (int id = 0; id < 10; id++) {
            assertTrue(set.contains(id));
            assertEquals(id, set.get(id)[1][1]);
        }
        assertEquals(10, reader.reads.get());
        assertEquals(10, progress.size());
        assertTrue(progress.contains(10));
    }

    @Test
    public void testCountMismatchReadsNothing() throws Exception {
        createFlats(9);
        CountingReader reader = new CountingReader(null);
        FlatLoader loader = new FlatLoader(reader, pool, 4);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> loader.load(flatDir, 10, null).get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof CountMismatchException);
        assertEquals(9, ((CountMismatchException) e.getCause()).getFound());
        assertEquals(0, reader.reads.get());
    }

    @Test
    public void testUnreadableFileFailsTheLoad() throws Exception {
        createFlats(6);
        CountingReader reader = new CountingReader("domeflat-3.fits");
        List<Path> failed = new CopyOnWriteArrayList<>();
        FlatLoader loader = new FlatLoader(reader, pool, 3);

        CompletionException e = assertThrows(CompletionException.class,
                () -> loader.load(flatDir, 6, new FlatLoadProgressListener() {
                    @Override
                    public void onProgress(int loaded, int expected) {
                    }

                    @Override
                    public void onFileFailed(Path path, Exception error) {
                        failed.add(path);
                    }
                }).join());
        assertTrue(e.getCause() instanceof FlatLoadException);
        // the other files were still read
        assertEquals(6, reader.reads.get());
        assertEquals(1, failed.size());
    }

    @Test
    public void testDuplicateDetectorIds() throws Exception {
        Files.createFile(flatDir.resolve("a-1.fits"));
        Files.createFile(flatDir.resolve("b-1.fits"));
        FlatLoader loader = new FlatLoader(new CountingReader(null), pool, 2);
        CompletionException e = assertThrows(CompletionException.class, () -> loader.load(flatDir, 2, null).join());
        assertTrue(e.getCause() instanceof FlatLoadException);
    }

    @Test
    public void testFindFlatFiles() throws Exception {
        Files.createFile(flatDir.resolve("flat-12.fits"));
        Files.createFile(flatDir.resolve("flat-3.fits"));
        Files.createFile(flatDir.resolve("flat.fits"));
        Files.createFile(flatDir.resolve("-7.fits"));
        Files.createFile(flatDir.resolve("flat-99999999999.fits"));

        Map<Path, Integer> found = FlatLoader.findFlatFiles(flatDir);
        assertEquals(2, found.size());
        assertEquals(Integer.valueOf(12), found.get(flatDir.resolve("flat-12.fits")));
        assertEquals(Integer.valueOf(3), found.get(flatDir.resolve("flat-3.fits")));
    }

    @Test
    public void testSplitN() {
        List<Integer> items = Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        List<List<Integer>> groups = FlatLoader.splitN(items, 4);
        assertEquals(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4, 5, 6), Arrays.asList(7, 8),
                Arrays.asList(9, 10)), groups);

        assertEquals(2, FlatLoader.splitN(Arrays.asList(1, 2), 6).size());
        assertTrue(FlatLoader.splitN(Collections.emptyList(), 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> FlatLoader.splitN(items, 0));
    }
}
