package com.quicklook.server.frame;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FitsFrameReaderTest {

    @TempDir
    Path dir;

    private final FitsFrameReader reader = new FitsFrameReader();

    @Test
    public void testReadsHeaderAndScaledPixels() throws Exception {
        short[][] data = { { 0, 1, 2 }, { 10, 20, 30 } };
        Path file = dir.resolve("SUPA00000107.fits");
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            hdu.addValue("DET-ID", 7, "detector");
            hdu.addValue("S_GAIN1", 3.1, "gain");
            hdu.addValue("BSCALE", 2.0, "");
            hdu.addValue("BZERO", 1000.0, "");
            fits.addHDU(hdu);
            try (BufferedFile bf = new BufferedFile(file.toFile(), "rw")) {
                fits.write(bf);
            }
        }

        RawFrame raw = reader.read(file);
        assertEquals(2, raw.getHeight());
        assertEquals(3, raw.getWidth());
        assertEquals(1000.0, raw.getPixels()[0][0]);
        assertEquals(1060.0, raw.getPixels()[1][2]);

        assertEquals(7, raw.getMetadata().getDetectorId());
        assertEquals(7, raw.getFrame().getDetectorId());
        assertEquals(107, raw.getFrame().getNumber());
        assertEquals(3.1, raw.getMetadata().getDouble("S_GAIN1").get(), 1e-9);
    }

    @Test
    public void testMissingDetectorIdIsUnknown() throws Exception {
        Path file = dir.resolve("SUPA00000100.fits");
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(new float[][] { { 1.5f, 2.5f } }));
            try (BufferedFile bf = new BufferedFile(file.toFile(), "rw")) {
                fits.write(bf);
            }
        }
        RawFrame raw = reader.read(file);
        assertEquals(Frame.UNKNOWN_DETECTOR, raw.getMetadata().getDetectorId());
        assertEquals(2.5, raw.getPixels()[0][1], 1e-9);
    }

    @Test
    public void testUnreadableFileIsIOException() throws Exception {
        Path file = Files.write(dir.resolve("SUPA00000101.fits"), "not a fits file".getBytes());
        assertThrows(IOException.class, () -> reader.read(file));
    }

    @Test
    public void testUnsignedBytes() {
        byte[][] kernel = { { (byte) 200, 5 } };
        double[][] out = FitsFrameReader.toDoubles(kernel, 1.0, 0.0);
        assertEquals(200.0, out[0][0]);
        assertEquals(5.0, out[0][1]);
    }

    @Test
    public void testScalingAppliedToEveryKernelType() {
        short[][] shorts = { { -2, 3 }, { 10, 0 } };
        double[][] out = FitsFrameReader.toDoubles(shorts, 2.0, 32768.0);
        assertEquals(32764.0, out[0][0]);
        assertEquals(32788.0, out[1][0]);

        float[][] floats = { { 1.5f } };
        assertEquals(0.75, FitsFrameReader.toDoubles(floats, 0.5, 0.0)[0][0]);

        byte[][] bytes = { { (byte) 255 } };
        assertEquals(-255.0, FitsFrameReader.toDoubles(bytes, -1.0, 0.0)[0][0]);
    }

    @Test
    public void testDoubleKernelIsCopiedNotScaledInPlace() {
        double[][] kernel = { { 1.0, 2.0 } };
        double[][] out = FitsFrameReader.toDoubles(kernel, 3.0, 1.0);
        assertEquals(4.0, out[0][0]);
        assertEquals(7.0, out[0][1]);
        assertEquals(1.0, kernel[0][0]);
    }

    @Test
    public void testUnsupportedKernelRejected() {
        assertThrows(IllegalArgumentException.class, () -> FitsFrameReader.toDoubles(new int[] { 1 }, 1.0, 0.0));
    }
}
