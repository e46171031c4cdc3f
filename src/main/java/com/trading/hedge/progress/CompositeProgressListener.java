package com.trading.hedge.progress;

import java.util.Arrays;

import com.trading.hedge.model.ProgressSnapshot;

/**
 * Fans a snapshot out to several {@link ProgressListener}s without allocating
 * on the delivery path.
 */
public class CompositeProgressListener implements ProgressListener {
    private volatile ProgressListener[] listeners = new ProgressListener[0];

    public synchronized void add(ProgressListener listener) {
        ProgressListener[] old = listeners;
        ProgressListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        for (ProgressListener l : listeners) {
            l.onProgress(snapshot);
        }
    }
}
