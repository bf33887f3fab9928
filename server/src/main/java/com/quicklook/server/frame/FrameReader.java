package com.quicklook.server.frame;

import java.io.IOException;
import java.nio.file.Path;

public interface FrameReader {
    /**
     * Reads header and primary image of one frame file.
     */
    RawFrame read(Path path) throws IOException;
}
