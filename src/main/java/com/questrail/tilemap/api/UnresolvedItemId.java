package com.questrail.tilemap.api;

import java.util.Objects;

/**
 * The on-disk id of an item that could not be translated while loading.
 *
 * <p>An item carrying this marker holds the placeholder id in memory. A save
 * into the same {@link IdSpace} re-emits {@code rawId} unchanged; a save into
 * the other id space cannot represent the item.</p>
 */
public record UnresolvedItemId(int rawId, IdSpace space)
{
    public UnresolvedItemId {
        Objects.requireNonNull(space, "space");
        if (rawId < 0 || rawId > 0xFFFF) {
            throw new IllegalArgumentException("rawId out of range: " + rawId);
        }
    }
}
