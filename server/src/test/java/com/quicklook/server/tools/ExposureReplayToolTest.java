package com.quicklook.server.tools;

import com.quicklook.server.SyntheticFrames;
import com.quicklook.server.config.QuicklookConfig;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class ExposureReplayToolTest {

    @TempDir
    Path frameDir;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    public void teardown() {
        pool.shutdownNow();
    }

    private void writeFrame(int number) throws Exception {
        Path file = frameDir.resolve(String.format("SUPA%08d.fits", number));
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(SyntheticFrames.pixels());
            for (Map.Entry<String, Object> e : SyntheticFrames.headers("S", number % 10).entrySet()) {
                if (e.getValue() instanceof Integer) {
                    hdu.addValue(e.getKey(), ((Integer) e.getValue()).intValue(), "");
                } else {
                    hdu.addValue(e.getKey(), Double.parseDouble(e.getValue().toString()), "");
                }
            }
            fits.addHDU(hdu);
            try (BufferedFile bf = new BufferedFile(file.toFile(), "rw")) {
                fits.write(bf);
            }
        }
    }

    @Test
    public void testReplaysFitsFramesByExposure() throws Exception {
        writeFrame(101);
        writeFrame(100);
        writeFrame(112);
        Files.createFile(frameDir.resolve("notes.txt"));

        Map<Integer, List<String>> groups = ExposureReplayTool.groupByExposure(frameDir, 10);
        assertEquals(2, groups.size());
        assertTrue(groups.get(100).get(0).endsWith("SUPA00000100.fits"));

        int tiles = ExposureReplayTool.replay(new QuicklookConfig(), frameDir, null, pool);
        assertEquals(3, tiles);
    }
}
