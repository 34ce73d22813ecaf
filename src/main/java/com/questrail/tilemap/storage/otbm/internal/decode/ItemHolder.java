package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Position;

/**
 * A frame that receives finished items: a tile, or a container item.
 */
interface ItemHolder
{
    /**
     * Position of the tile the items end up on, for issue reporting.
     */
    Position position();

    void acceptItem(Item item, DecodeContext ctx);
}
