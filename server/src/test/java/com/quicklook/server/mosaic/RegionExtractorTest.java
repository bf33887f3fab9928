package com.quicklook.server.mosaic;

import com.quicklook.server.SyntheticFrames;
import com.quicklook.server.frame.FrameMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RegionExtractorTest {

    private final RegionExtractor extractor = new RegionExtractor("S");

    @Test
    public void testGeometryFromHeaders() throws Exception {
        ImageGeometry g = extractor.extract(new FrameMetadata(SyntheticFrames.headers("S", 3)));

        assertEquals(4 * SyntheticFrames.CHANNEL_WIDTH, g.getNewWidth());
        assertEquals(SyntheticFrames.HEIGHT, g.getNewHeight());
        assertEquals(4 * SyntheticFrames.OVERSCAN_WIDTH, g.getXCut());
        assertEquals(SyntheticFrames.HEIGHT, g.getYCut());

        // 1-based header values become 0-based
        ChannelRegion ch2 = g.getChannel(2);
        assertEquals(0, ch2.getEfMinX());
        assertEquals(3, ch2.getEfMaxX());
        assertEquals(4, ch2.getOsMinX());
        assertEquals(3.2, ch2.getGain(), 1e-12);
    }

    @Test
    public void testStartPositionsFollowEffectiveMaxX() throws Exception {
        ImageGeometry g = extractor.extract(new FrameMetadata(SyntheticFrames.headers("S", 3)));

        int sum = 0;
        for (ChannelRegion ch : g.getChannels()) {
            sum += ch.getEffectiveWidth();
        }
        assertEquals(sum, g.getNewWidth());

        List<ChannelRegion> byPos = g.getChannelsByPosition();
        for (int i = 1; i < byPos.size(); i++) {
            assertTrue(byPos.get(i).getStartPosX() > byPos.get(i - 1).getStartPosX());
            assertTrue(byPos.get(i).getEfMaxX() > byPos.get(i - 1).getEfMaxX());
        }
        // physical order is 2, 4, 1, 3
        assertEquals(0, g.getChannel(2).getStartPosX());
        assertEquals(4, g.getChannel(4).getStartPosX());
        assertEquals(8, g.getChannel(1).getStartPosX());
        assertEquals(12, g.getChannel(3).getStartPosX());
    }

    @Test
    public void testMissingKeyword() {
        Map<String, Object> h = SyntheticFrames.headers("S", 3);
        h.remove("S_OSMX32");
        MalformedMetadataException e = assertThrows(MalformedMetadataException.class,
                () -> extractor.extract(new FrameMetadata(h)));
        assertEquals("S_OSMX32", e.getKeyword());
    }

    @Test
    public void testNonNumericKeyword() {
        Map<String, Object> h = SyntheticFrames.headers("S", 3);
        h.put("S_GAIN4", "n/a");
        assertThrows(MalformedMetadataException.class, () -> extractor.extract(new FrameMetadata(h)));
    }

    @Test
    public void testFractionalCoordinate() {
        Map<String, Object> h = SyntheticFrames.headers("S", 3);
        h.put("S_EFMN11", "15.5");
        assertThrows(MalformedMetadataException.class, () -> extractor.extract(new FrameMetadata(h)));
    }

    @Test
    public void testWrongPrefixFindsNothing() {
        RegionExtractor hsc = new RegionExtractor("T");
        assertThrows(MalformedMetadataException.class,
                () -> hsc.extract(new FrameMetadata(SyntheticFrames.headers("S", 3))));
    }
}
