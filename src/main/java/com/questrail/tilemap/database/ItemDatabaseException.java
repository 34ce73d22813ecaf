package com.questrail.tilemap.database;

/**
 * Indicates an item database file that could not be read.
 */
public final class ItemDatabaseException extends Exception
{
    public ItemDatabaseException(String message) {
        super(message);
    }

    public ItemDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
