package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

/**
 * Raised when a ClientID-space map is read or written without an item
 * database to translate ids through.
 */
public final class ItemDatabaseUnavailableException extends MapFormatException
{
    public ItemDatabaseUnavailableException(String message) {
        super(message);
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.ItemDatabaseUnavailable(getMessage());
    }
}
