package com.quicklook.server.config;

/**
 * Placement of one detector's corrected tile within an exposure canvas.
 */
public class TileOffset {
    public int x;
    public int y;

    public TileOffset() {
    }

    public TileOffset(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() {
        return "TileOffset{x=" + x + ", y=" + y + "}";
    }
}
