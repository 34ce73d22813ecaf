package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.storage.otbm.format.NodeKind;

import java.util.Objects;

/**
 * An item whose contents are still being read. The item is built and handed
 * to its holder when the node closes, so containers are immutable once seen.
 */
final class ItemFrame extends DecodeFrame implements ItemHolder
{
    private final ItemHolder holder;
    private final Item.Builder item;

    ItemFrame(ItemHolder holder, Item.Builder item) {
        super(NodeKind.ITEM);
        this.holder = Objects.requireNonNull(holder, "holder");
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public Position position() {
        return holder.position();
    }

    @Override
    public void acceptItem(Item child, DecodeContext ctx) {
        item.addContent(child);
    }

    @Override
    public void close(DecodeContext ctx) {
        holder.acceptItem(item.build(), ctx);
    }
}
