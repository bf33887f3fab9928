package com.quicklook.server.flat;

import java.nio.file.Path;

public interface FlatLoadProgressListener {

    /**
     * Called from a worker thread after each successful insertion.
     */
    void onProgress(int loaded, int expected);

    default void onFileFailed(Path path, Exception error) {
    }
}
