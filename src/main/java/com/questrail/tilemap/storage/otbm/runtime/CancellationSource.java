package com.questrail.tilemap.storage.otbm.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link CancellationToken} that another thread can trigger.
 */
public final class CancellationSource implements CancellationToken
{
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
