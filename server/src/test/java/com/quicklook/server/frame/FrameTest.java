package com.quicklook.server.frame;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FrameTest {

    @Test
    public void testParsePath() {
        Optional<Frame> f = Frame.fromPath("/gen2/data/SUPA00001234.fits");
        assertTrue(f.isPresent());
        assertEquals("SUP", f.get().getInscode());
        assertEquals('A', f.get().getFrameType());
        assertEquals(1234, f.get().getNumber());
        assertEquals(Frame.UNKNOWN_DETECTOR, f.get().getDetectorId());
        assertEquals("SUPA00001234", f.get().getFrameId());
        assertEquals("SUPA00001230", f.get().withNumber(1230).getFrameId());
    }

    @Test
    public void testCompressedAndLowerCaseNames() {
        assertEquals(17, Frame.fromPath("/d/supa00000017.fits.fz").get().getNumber());
    }

    @Test
    public void testRejectsOtherNames() {
        assertFalse(Frame.fromPath("/d/flat-3.fits").isPresent());
        assertFalse(Frame.fromPath("/d/SUPA0000123.fits").isPresent());
        assertFalse(Frame.fromPath("").isPresent());
        assertFalse(Frame.fromPath(null).isPresent());
    }

    @Test
    public void testMetadataConversions() {
        Map<String, Object> kw = new HashMap<>();
        kw.put("DET-ID", "4");
        kw.put("S_GAIN1", "3.25");
        kw.put("NAXIS1", 2048);
        kw.put("OBJECT", "M31");
        FrameMetadata md = new FrameMetadata(kw);

        assertEquals(4, md.getDetectorId());
        assertEquals(3.25, md.getDouble("S_GAIN1").get(), 1e-12);
        assertEquals(2048, md.getInt("NAXIS1").get());
        assertFalse(md.getInt("OBJECT").isPresent());
        assertFalse(md.getDouble("MISSING").isPresent());
        assertEquals(Frame.UNKNOWN_DETECTOR, new FrameMetadata(new HashMap<>()).getDetectorId());
    }
}
