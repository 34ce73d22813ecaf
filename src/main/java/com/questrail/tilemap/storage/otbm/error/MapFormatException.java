package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

/**
 * MapFormatException
 * -----------------------------------------------------------------------------
 * Base type of the fatal conditions raised inside the storage engine.
 *
 * <p>These exceptions never leave the engine's public operations: the load and
 * save entry points catch them and report {@link #toFailure()} instead.</p>
 */
public abstract class MapFormatException extends RuntimeException
{
    protected MapFormatException(String message) {
        super(message);
    }

    protected MapFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract MapIoFailure toFailure();
}
