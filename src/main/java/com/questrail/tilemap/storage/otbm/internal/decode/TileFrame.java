package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.OpaqueNode;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * TileFrame
 * -----------------------------------------------------------------------------
 * A tile whose items are still being read.
 *
 * <p>On close the tile is installed in the map. A tile outside the declared
 * map size is kept with a warning; a second tile at the same position
 * replaces the first, also with a warning. The house id read from a
 * house-tile payload is applied through {@link GameMap#assignHouse} so the
 * map's membership index stays consistent.</p>
 */
final class TileFrame extends DecodeFrame implements ItemHolder
{
    private final Tile tile;
    private final OptionalInt houseId;

    TileFrame(NodeKind kind, Tile tile, OptionalInt houseId) {
        super(kind);
        this.tile = Objects.requireNonNull(tile, "tile");
        this.houseId = Objects.requireNonNull(houseId, "houseId");
    }

    Tile tile() {
        return tile;
    }

    @Override
    public Position position() {
        return tile.position();
    }

    /**
     * The first ground-classified item becomes the ground unless the tile
     * already has one; every other item is stacked.
     */
    @Override
    public void acceptItem(Item item, DecodeContext ctx) {
        if (tile.ground().isEmpty() && ctx.isGround(item.id())) {
            tile.setGround(item);
        } else {
            tile.addItem(item);
        }
    }

    @Override
    public boolean keepsOpaqueChildren() {
        return true;
    }

    @Override
    public void acceptOpaque(OpaqueNode node) {
        tile.addOpaqueNode(node);
    }

    @Override
    public void close(DecodeContext ctx)
    {
        GameMap map = ctx.map();
        Position pos = tile.position();
        if (!map.header().contains(pos)) {
            ctx.report(MapIoIssue.at(IssueCode.TILE_OUT_OF_BOUNDS,
                    "tile lies outside the declared map size " + map.header().width() + "x" + map.header().height()
                            + " or below floor " + MapHeader.MAX_FLOOR,
                    pos));
        }
        if (map.putTile(tile).isPresent()) {
            ctx.report(MapIoIssue.at(IssueCode.DUPLICATE_TILE, "tile defined twice; the later one is kept", pos));
        }
        if (houseId.isPresent()) {
            map.assignHouse(pos, houseId);
        }
    }
}
