package com.quicklook.server.service;

import com.quicklook.server.RecordingNotifier;
import com.quicklook.server.flat.FlatFieldSet;
import com.quicklook.server.flat.FlatLoader;
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
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class FlatFieldServiceTest {

    @TempDir
    Path root;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final RecordingNotifier notifier = new RecordingNotifier();

    @AfterEach
    public void teardown() {
        pool.shutdownNow();
    }

    /**
     * Blocks reads under the "slow" directory until released.
     */
    private static class GatedReader implements FrameReader {
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public RawFrame read(Path path) throws IOException {
            if (path.getParent().getFileName().toString().equals("slow")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            return new RawFrame(new Frame(path.toString(), "", ' ', -1, 1), new FrameMetadata(Collections.emptyMap()),
                    new double[][] { { 1.0 } });
        }
    }

    private Path flatDir(String name) throws IOException {
        Path dir = Files.createDirectory(root.resolve(name));
        Files.createFile(dir.resolve("flat-1.fits"));
        return dir;
    }

    @Test
    public void testOnlyNewestLoadPublishes() throws Exception {
        Path slow = flatDir("slow");
        Path fast = flatDir("fast");
        GatedReader reader = new GatedReader();
        FlatFieldService service = new FlatFieldService(new FlatLoader(reader, pool, 1), 1, "", true, notifier);

        CompletableFuture<FlatFieldSet> first = service.startLoad(slow.toString());
        FlatFieldSet second = service.startLoad(fast.toString()).get(5, TimeUnit.SECONDS);
        assertEquals(fast.toString(), service.getActiveSet().getSourceDirectory());

        reader.release.countDown();
        FlatFieldSet stale = first.get(5, TimeUnit.SECONDS);
        assertEquals(slow.toString(), stale.getSourceDirectory());
        // the earlier load finished last but did not replace the newer set
        assertSame(second, service.getActiveSet());
        assertEquals(FlatLoadStatus.State.COMPLETE, service.getStatus().getState());
        assertEquals(2, service.getStatus().getGeneration());
    }

    @Test
    public void testFailedLoadKeepsPreviousSet() throws Exception {
        Path good = flatDir("good");
        Path empty = Files.createDirectory(root.resolve("empty"));
        FlatFieldService service = new FlatFieldService(new FlatLoader(new GatedReader(), pool, 1), 1, "", true,
                notifier);

        FlatFieldSet loaded = service.startLoad(good.toString()).get(5, TimeUnit.SECONDS);
        CompletableFuture<FlatFieldSet> failed = service.startLoad(empty.toString());
        assertThrows(Exception.class, () -> failed.get(5, TimeUnit.SECONDS));

        assertSame(loaded, service.getActiveSet());
        FlatLoadStatus status = service.getStatus();
        assertEquals(FlatLoadStatus.State.FAILED, status.getState());
        assertTrue(status.getLastError().contains("does not match number of CCDs"));
        assertEquals(1, notifier.errors.size());
    }

    @Test
    public void testDirectoryRequired() {
        FlatFieldService service = new FlatFieldService(new FlatLoader(new GatedReader(), pool, 1), 1, "", false,
                notifier);
        assertThrows(IllegalArgumentException.class, () -> service.startLoad(null));
        assertThrows(IllegalArgumentException.class, () -> service.startLoad("  "));
        assertEquals(FlatLoadStatus.State.IDLE, service.getStatus().getState());
    }

    @Test
    public void testUseFlatsToggle() {
        FlatFieldService service = new FlatFieldService(new FlatLoader(new GatedReader(), pool, 1), 1, "", false,
                notifier);
        assertFalse(service.isUseFlats());
        service.setUseFlats(true);
        assertTrue(service.getStatus().isUseFlats());
    }
}
