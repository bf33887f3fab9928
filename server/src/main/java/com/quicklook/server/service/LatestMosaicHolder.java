package com.quicklook.server.service;

import com.quicklook.server.mosaic.MosaicTile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default display: keeps the newest tile for the REST surface.
 */
@Service
public class LatestMosaicHolder implements MosaicDisplay {

    private static final Logger logger = LoggerFactory.getLogger(LatestMosaicHolder.class);

    private final AtomicReference<MosaicTile> current = new AtomicReference<>();

    @Override
    public void setCurrentImage(MosaicTile tile) {
        current.set(tile);
        logger.info("Current image: {}", tile);
    }

    public Optional<MosaicTile> getCurrent() {
        return Optional.ofNullable(current.get());
    }

    public Optional<TileSummary> getCurrentSummary() {
        return getCurrent().map(TileSummary::new);
    }
}
