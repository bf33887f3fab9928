package com.quicklook.server.mosaic;

import com.quicklook.server.config.TileOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Packages corrected frames into mosaic tiles.
 *
 * Without an offset table every frame already is the full multi-channel tile of
 * its detector and is passed through with its provenance. With an offset table
 * the frames are placed on one canvas at their detector's offset.
 */
public class MosaicAssembler {

    private static final Logger logger = LoggerFactory.getLogger(MosaicAssembler.class);

    public List<MosaicTile> assemble(String exposureName, List<CorrectedFrame> frames, boolean newExposure,
            Map<Integer, TileOffset> offsets) {
        if (frames == null || frames.isEmpty()) {
            return Collections.emptyList();
        }
        if (offsets == null || offsets.isEmpty()) {
            List<MosaicTile> tiles = new ArrayList<>();
            boolean first = true;
            for (CorrectedFrame cf : frames) {
                // only the first tile of a new exposure starts a new mosaic
                tiles.add(passThrough(exposureName, cf, newExposure && first));
                first = false;
            }
            return tiles;
        }
        MosaicTile tile = place(exposureName, frames, newExposure, offsets);
        return tile == null ? Collections.emptyList() : Collections.singletonList(tile);
    }

    private MosaicTile passThrough(String exposureName, CorrectedFrame cf, boolean newExposure) {
        int number = cf.getFrame().getNumber();
        return new MosaicTile(exposureName, cf.getData(), new LinkedHashMap<>(cf.getMetadata()),
                Collections.singletonList(cf.getFrame().getDetectorId()), number, number, newExposure,
                cf.isFlatApplied());
    }

    private MosaicTile place(String exposureName, List<CorrectedFrame> frames, boolean newExposure,
            Map<Integer, TileOffset> offsets) {
        // 1. Keep frames that have a placement
        List<CorrectedFrame> placed = new ArrayList<>();
        int width = 0;
        int height = 0;
        for (CorrectedFrame cf : frames) {
            TileOffset off = offsets.get(cf.getFrame().getDetectorId());
            if (off == null) {
                logger.warn("No tile offset for detector {} ({}), frame skipped", cf.getFrame().getDetectorId(),
                        cf.getFrame());
                continue;
            }
            if (off.x < 0 || off.y < 0) {
                logger.warn("Negative tile offset {} for detector {}, frame skipped", off,
                        cf.getFrame().getDetectorId());
                continue;
            }
            placed.add(cf);
            width = Math.max(width, off.x + cf.getWidth());
            height = Math.max(height, off.y + cf.getHeight());
        }
        if (placed.isEmpty()) {
            return null;
        }

        // 2. Copy onto the canvas; uncovered pixels stay NaN
        double[][] canvas = new double[height][width];
        for (double[] row : canvas) {
            Arrays.fill(row, Double.NaN);
        }
        List<Integer> detectors = new ArrayList<>();
        int firstNumber = Integer.MAX_VALUE;
        int lastNumber = Integer.MIN_VALUE;
        boolean allFlat = true;
        for (CorrectedFrame cf : placed) {
            TileOffset off = offsets.get(cf.getFrame().getDetectorId());
            double[][] data = cf.getData();
            for (int r = 0; r < data.length; r++) {
                System.arraycopy(data[r], 0, canvas[off.y + r], off.x, data[r].length);
            }
            detectors.add(cf.getFrame().getDetectorId());
            firstNumber = Math.min(firstNumber, cf.getFrame().getNumber());
            lastNumber = Math.max(lastNumber, cf.getFrame().getNumber());
            allFlat &= cf.isFlatApplied();
        }

        Map<String, Object> metadata = new LinkedHashMap<>(placed.get(0).getMetadata());
        metadata.put("NAXIS1", width);
        metadata.put("NAXIS2", height);
        metadata.put("NDETS", placed.size());
        metadata.remove("DET-ID");

        logger.info("Assembled {} frames of {} into {}x{} canvas", placed.size(), exposureName, width, height);
        return new MosaicTile(exposureName, canvas, metadata, detectors, firstNumber, lastNumber, newExposure,
                allFlat);
    }
}
