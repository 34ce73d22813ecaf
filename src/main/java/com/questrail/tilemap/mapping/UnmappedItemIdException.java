package com.questrail.tilemap.mapping;

import com.questrail.tilemap.api.IdSpace;

import java.util.Locale;

/**
 * Raised when an item id has no counterpart in the other id space.
 */
public final class UnmappedItemIdException extends RuntimeException
{
    private final int id;
    private final IdSpace space;

    public UnmappedItemIdException(int id, IdSpace space) {
        super("no mapping for " + space.name().toLowerCase(Locale.ROOT) + " id " + id);
        this.id = id;
        this.space = space;
    }

    /**
     * The id that was looked up.
     */
    public int id() {
        return id;
    }

    /**
     * The id space {@link #id()} belongs to.
     */
    public IdSpace space() {
        return space;
    }
}
