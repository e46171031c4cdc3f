package com.trading.hedge.progress;

import com.trading.hedge.model.ProgressSnapshot;

/**
 * Receives a snapshot after every completed unit of work.
 *
 * Called on the notification delivery thread, outside the tracker's lock.
 * Implementations must be lightweight.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressSnapshot snapshot);
}
