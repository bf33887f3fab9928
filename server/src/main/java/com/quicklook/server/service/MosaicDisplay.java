package com.quicklook.server.service;

import com.quicklook.server.mosaic.MosaicTile;

/**
 * Receiver of finished mosaic tiles (the viewer side).
 */
public interface MosaicDisplay {
    void setCurrentImage(MosaicTile tile);
}
