package com.questrail.tilemap.storage.otbm.runtime;

import com.questrail.tilemap.storage.otbm.error.OperationCancelledException;

/**
 * Cooperative cancellation signal for long loads.
 *
 * <p>The loader polls the token before each tile area and before the town
 * and waypoint lists. A cancelled load discards the partly built map and
 * reports a cancellation failure.</p>
 */
public interface CancellationToken
{
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new OperationCancelledException("load cancelled");
        }
    }
}
