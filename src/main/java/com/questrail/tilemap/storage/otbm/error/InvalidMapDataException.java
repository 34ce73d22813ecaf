package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

/**
 * Raised on save when an in-memory value does not fit its on-disk field.
 */
public final class InvalidMapDataException extends MapFormatException
{
    public InvalidMapDataException(String message) {
        super(message);
    }

    public InvalidMapDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.InvalidMapData(getMessage());
    }
}
