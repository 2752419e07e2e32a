package com.sysmuse.hash;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal. The pipeline polls it between files and between fields,
 * so a request takes effect once the file being processed is done, not mid-file.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param where description of the boundary, used in the exception message
     * @throws RunCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String where) {
        if (cancelled.get()) {
            throw new RunCancelledException(where);
        }
    }
}
