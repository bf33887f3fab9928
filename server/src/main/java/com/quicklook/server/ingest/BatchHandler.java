package com.quicklook.server.ingest;

import java.util.List;

public interface BatchHandler {
    /**
     * Called on the tick thread with every path queued since the last tick, in
     * arrival order. Never called with an empty list.
     */
    void onBatch(List<String> paths);
}
