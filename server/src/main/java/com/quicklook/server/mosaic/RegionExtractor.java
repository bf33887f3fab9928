package com.quicklook.server.mosaic;

import com.quicklook.server.frame.FrameMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads the effective-pixel and overscan regions of the four readout channels
 * from header keywords of the form {@code <PFX>_EFMN{c}1}, {@code <PFX>_OSMX{c}2},
 * {@code <PFX>_GAIN{c}}. Header values are 1-based pixel coordinates.
 */
public class RegionExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RegionExtractor.class);

    public static final int NUM_CHANNELS = 4;

    private final String keywordPrefix;

    public RegionExtractor(String keywordPrefix) {
        this.keywordPrefix = keywordPrefix;
    }

    public ImageGeometry extract(FrameMetadata metadata) throws MalformedMetadataException {
        List<ChannelRegion> channels = new ArrayList<>();
        int xCut = 0;
        int newWidth = 0;
        ChannelRegion last = null;

        for (int ch = 1; ch <= NUM_CHANNELS; ch++) {
            int efMinX = coordinate(metadata, regionKey(keywordPrefix, "EF", "MN", ch, 1));
            int efMaxX = coordinate(metadata, regionKey(keywordPrefix, "EF", "MX", ch, 1));
            int efMinY = coordinate(metadata, regionKey(keywordPrefix, "EF", "MN", ch, 2));
            int efMaxY = coordinate(metadata, regionKey(keywordPrefix, "EF", "MX", ch, 2));
            int osMinX = coordinate(metadata, regionKey(keywordPrefix, "OS", "MN", ch, 1));
            int osMaxX = coordinate(metadata, regionKey(keywordPrefix, "OS", "MX", ch, 1));
            int osMinY = coordinate(metadata, regionKey(keywordPrefix, "OS", "MN", ch, 2));
            int osMaxY = coordinate(metadata, regionKey(keywordPrefix, "OS", "MX", ch, 2));
            double gain = number(metadata, gainKey(keywordPrefix, ch));

            if (efMaxX < efMinX || efMaxY < efMinY || osMaxX < osMinX || osMaxY < osMinY) {
                throw new MalformedMetadataException(regionKey(keywordPrefix, "EF", "MX", ch, 1),
                        "Channel " + ch + " has inverted region bounds");
            }

            ChannelRegion region = new ChannelRegion(ch, efMinX, efMaxX, efMinY, efMaxY,
                    osMinX, osMaxX, osMinY, osMaxY, gain);
            xCut += region.getOverscanWidth();
            newWidth += region.getEffectiveWidth();
            channels.add(region);
            last = region;
        }

        // starting x position of each channel follows physical order, not header order
        List<ChannelRegion> byMaxX = new ArrayList<>(channels);
        byMaxX.sort(Comparator.comparingInt(ChannelRegion::getEfMaxX));
        int startPosX = 0;
        for (ChannelRegion region : byMaxX) {
            region.setStartPosX(startPosX);
            startPosX += region.getEffectiveWidth();
        }

        int yCut = last.getOverscanHeight();
        int newHeight = last.getEffectiveHeight();

        ImageGeometry geometry = new ImageGeometry(channels, xCut, yCut, newWidth, newHeight);
        logger.debug("Extracted geometry {}", geometry);
        return geometry;
    }

    public static String regionKey(String prefix, String region, String bound, int channel, int axis) {
        return prefix + "_" + region + bound + channel + axis;
    }

    public static String gainKey(String prefix, int channel) {
        return prefix + "_GAIN" + channel;
    }

    private static int coordinate(FrameMetadata metadata, String key) throws MalformedMetadataException {
        double v = number(metadata, key);
        if (v != Math.rint(v)) {
            throw new MalformedMetadataException(key, "Keyword " + key + " is not an integer pixel: " + v);
        }
        return (int) v - 1;
    }

    private static double number(FrameMetadata metadata, String key) throws MalformedMetadataException {
        if (!metadata.contains(key)) {
            throw new MalformedMetadataException(key, "Missing keyword " + key);
        }
        Optional<Double> value = metadata.getDouble(key);
        if (value.isEmpty() || value.get().isNaN()) {
            throw new MalformedMetadataException(key,
                    "Keyword " + key + " is not numeric: '" + metadata.get(key) + "'");
        }
        return value.get();
    }
}
