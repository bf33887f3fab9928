package com.quicklook.server.mosaic;

import com.quicklook.util.ArrayMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes the overscan columns of a raw frame and subtracts the per-row bias
 * estimated from them.
 *
 * For each channel the bias of a row is the median of that row's overscan
 * columns, taken over the channel's effective rows only. The effective block
 * minus its row biases is copied into the output at the channel's start column.
 * All arithmetic is done in double precision and the result is not rounded.
 */
public class OverscanCorrector {

    private static final Logger logger = LoggerFactory.getLogger(OverscanCorrector.class);

    public CorrectionResult correct(double[][] raw, ImageGeometry geometry, String keywordPrefix,
            boolean subtractBias) throws RegionMismatchException {
        int newWidth = geometry.getNewWidth();
        int newHeight = geometry.getNewHeight();
        int rawHeight = raw.length;
        int rawWidth = rawHeight == 0 ? 0 : raw[0].length;

        // 1. Check every channel against the raw frame before anything is allocated
        List<ChannelRegion> channels = geometry.getChannels();
        double[][] rowBias = new double[channels.size()][];
        for (int i = 0; i < channels.size(); i++) {
            ChannelRegion ch = channels.get(i);
            if (ch.getEfMinX() < 0 || ch.getEfMaxX() >= rawWidth) {
                throw new RegionMismatchException(ch.getChannel(), String.format(
                        "Channel %d: effective columns %d..%d outside frame width %d",
                        ch.getChannel(), ch.getEfMinX(), ch.getEfMaxX(), rawWidth));
            }
            if (ch.getEffectiveHeight() != newHeight) {
                throw new RegionMismatchException(ch.getChannel(), String.format(
                        "Channel %d: effective height %d differs from mosaic height %d",
                        ch.getChannel(), ch.getEffectiveHeight(), newHeight));
            }
            if (ch.getStartPosX() + ch.getEffectiveWidth() > newWidth) {
                throw new RegionMismatchException(ch.getChannel(), String.format(
                        "Channel %d: %d columns at column %d do not fit output width %d",
                        ch.getChannel(), ch.getEffectiveWidth(), ch.getStartPosX(), newWidth));
            }
            // per-row overscan median over the effective rows present in the array
            rowBias[i] = overscanRowMedians(raw, ch, rawHeight, rawWidth);
            if (rowBias[i].length != ch.getEffectiveHeight()) {
                throw new RegionMismatchException(ch.getChannel(), String.format(
                        "Channel %d: median array length (%d) doesn't match effective pixel length (%d)",
                        ch.getChannel(), rowBias[i].length, ch.getEffectiveHeight()));
            }
        }
        if (newWidth > rawWidth || newHeight > rawHeight) {
            throw new RegionMismatchException(0, String.format(
                    "Trimmed size %dx%d exceeds frame size %dx%d", newWidth, newHeight, rawWidth, rawHeight));
        }

        // 2. Cut effective blocks into the output, minus row bias
        double[][] out = new double[newHeight][newWidth];
        for (int i = 0; i < channels.size(); i++) {
            ChannelRegion ch = channels.get(i);
            int x0 = ch.getStartPosX();
            for (int r = 0; r < ch.getEffectiveHeight(); r++) {
                double[] src = raw[ch.getEfMinY() + r];
                double[] dst = out[r];
                double bias = subtractBias ? rowBias[i][r] : 0.0;
                for (int c = 0; c < ch.getEffectiveWidth(); c++) {
                    dst[x0 + c] = src[ch.getEfMinX() + c] - bias;
                }
            }
            logger.debug("Channel {} corrected: {}x{} at x={}", ch.getChannel(), ch.getEffectiveWidth(),
                    ch.getEffectiveHeight(), x0);
        }

        return new CorrectionResult(out, trimmedRegionKeywords(geometry, keywordPrefix), subtractBias);
    }

    private static double[] overscanRowMedians(double[][] raw, ChannelRegion ch, int rawHeight, int rawWidth)
            throws RegionMismatchException {
        int osLo = Math.max(0, ch.getOsMinX());
        int osHi = Math.min(rawWidth - 1, ch.getOsMaxX());
        if (osHi < osLo) {
            throw new RegionMismatchException(ch.getChannel(), String.format(
                    "Channel %d: overscan columns %d..%d outside frame width %d",
                    ch.getChannel(), ch.getOsMinX(), ch.getOsMaxX(), rawWidth));
        }
        int rowLo = Math.max(0, ch.getEfMinY());
        int rowHi = Math.min(rawHeight - 1, ch.getEfMaxY());
        int rows = Math.max(0, rowHi - rowLo + 1);

        double[] medians = new double[rows];
        for (int i = 0; i < rows; i++) {
            medians[i] = ArrayMath.median(raw[rowLo + i], osLo, osHi + 1);
        }
        return medians;
    }

    /**
     * Effective-region keywords describing the trimmed output: channels are
     * contiguous from column 1 and span rows 1..newHeight (1-based, like the
     * input headers).
     */
    static Map<String, Object> trimmedRegionKeywords(ImageGeometry geometry, String prefix) {
        Map<String, Object> updates = new LinkedHashMap<>();
        for (ChannelRegion ch : geometry.getChannels()) {
            int c = ch.getChannel();
            updates.put(RegionExtractor.regionKey(prefix, "EF", "MN", c, 1), ch.getStartPosX() + 1);
            updates.put(RegionExtractor.regionKey(prefix, "EF", "MX", c, 1),
                    ch.getStartPosX() + ch.getEffectiveWidth());
            updates.put(RegionExtractor.regionKey(prefix, "EF", "MN", c, 2), 1);
            updates.put(RegionExtractor.regionKey(prefix, "EF", "MX", c, 2), ch.getEffectiveHeight());
        }
        updates.put("NAXIS1", geometry.getNewWidth());
        updates.put("NAXIS2", geometry.getNewHeight());
        return updates;
    }
}
