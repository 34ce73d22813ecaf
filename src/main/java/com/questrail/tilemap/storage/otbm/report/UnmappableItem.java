package com.questrail.tilemap.storage.otbm.report;

import com.questrail.tilemap.api.Position;

/**
 * An item that cannot be written in the target id space.
 *
 * @param position tile holding the item (directly or inside a container)
 * @param itemId   the in-memory ServerID, or the raw id of an unresolved item
 */
public record UnmappableItem(Position position, int itemId)
{
}
