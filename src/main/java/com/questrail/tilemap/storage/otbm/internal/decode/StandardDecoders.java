package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.SpawnEntry;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.api.Town;
import com.questrail.tilemap.api.Waypoint;
import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.codec.PayloadReader;
import com.questrail.tilemap.storage.otbm.codec.TruncatedPayloadException;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.format.OtbmAttribute;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * StandardDecoders
 * =============================================================================
 * The {@link NodeDecoder}s for every node kind the engine understands.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>A tile area or tile whose fixed fields are cut short cannot be placed
 *       anywhere: that is structural corruption.</li>
 *   <li>A town, waypoint, spawn, zone list or item whose fixed fields are cut
 *       short is reported as {@link IssueCode#MALFORMED_NODE} and skipped
 *       together with its subtree.</li>
 *   <li>Attribute lists stop at the first unknown or malformed attribute; the
 *       rest of the payload is kept on the entity as its opaque remainder.</li>
 * </ul>
 */
final class StandardDecoders
{
    private StandardDecoders() {
    }

    // =========================================================================
    // Map data
    // =========================================================================

    static DecodeFrame mapData(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        GameMap map = ctx.map();
        MapHeader.Builder header = map.header().toBuilder();
        PayloadReader in = new PayloadReader(node.payload());

        while (in.isReadable()) {
            final int start = in.position();
            final int tag = in.readU8();
            Optional<OtbmAttribute> attribute = OtbmAttribute.fromTag(tag);
            if (attribute.isEmpty()) {
                map.setOpaqueRemainder(in.takeRemainderFrom(start));
                ctx.report(MapIoIssue.of(IssueCode.UNKNOWN_ATTRIBUTE,
                        String.format("unknown map attribute 0x%02X; remaining bytes kept verbatim", tag)));
                break;
            }
            try {
                switch (attribute.get()) {
                    case DESCRIPTION:        header.withDescription(in.readString()); break;
                    case EXT_SPAWN_FILE:     header.withSpawnFile(in.readString()); break;
                    case EXT_HOUSE_FILE:     header.withHouseFile(in.readString()); break;
                    case EXT_SPAWN_NPC_FILE: header.withNpcSpawnFile(in.readString()); break;
                    case EXT_ZONE_FILE:      header.withZoneFile(in.readString()); break;
                    default:
                        map.setOpaqueRemainder(in.takeRemainderFrom(start));
                        ctx.report(MapIoIssue.of(IssueCode.UNKNOWN_ATTRIBUTE,
                                "attribute " + attribute.get() + " is not a map attribute; remaining bytes kept verbatim"));
                        break;
                }
            }
            catch (TruncatedPayloadException e) {
                map.setOpaqueRemainder(in.takeRemainderFrom(start));
                ctx.report(MapIoIssue.of(IssueCode.MALFORMED_ATTRIBUTE,
                        "map attribute " + attribute.get() + " is cut short; remaining bytes kept verbatim"));
            }
        }
        map.setHeader(header.build());
        return new MapDataFrame(map);
    }

    // =========================================================================
    // Tiles
    // =========================================================================

    static DecodeFrame tileArea(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        PayloadReader in = new PayloadReader(node.payload());
        final int x;
        final int y;
        final int z;
        try {
            x = in.readU16();
            y = in.readU16();
            z = in.readU8();
        }
        catch (TruncatedPayloadException e) {
            throw ctx.corruption("tile area payload too short for its base position", node);
        }
        if (in.isReadable()) {
            ctx.report(MapIoIssue.at(IssueCode.MALFORMED_NODE,
                    in.readableBytes() + " unexpected bytes after the tile area position dropped",
                    Position.of(x, y, z)));
        }
        ctx.guard().countTileArea();
        return new TileAreaFrame(x, y, z);
    }

    static DecodeFrame tile(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        TileAreaFrame area = (TileAreaFrame) parent;
        NodeKind kind = node.type() == NodeKind.HOUSETILE.type() ? NodeKind.HOUSETILE : NodeKind.TILE;
        PayloadReader in = new PayloadReader(node.payload());

        final int offsetX;
        final int offsetY;
        long rawHouseId = 0;
        try {
            offsetX = in.readU8();
            offsetY = in.readU8();
            if (kind == NodeKind.HOUSETILE) {
                rawHouseId = in.readU32();
            }
        }
        catch (TruncatedPayloadException e) {
            throw ctx.corruption(kind + " payload too short for its position", node);
        }

        final int x = area.baseX() + offsetX;
        final int y = area.baseY() + offsetY;
        if (x > Position.MAX_XY || y > Position.MAX_XY) {
            ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE,
                    "tile at " + x + "," + y + " lies beyond the coordinate range; skipped"));
            return SkipFrame.INSTANCE;
        }
        final Position pos = Position.of(x, y, area.z());

        OptionalInt houseId = OptionalInt.empty();
        if (rawHouseId > Integer.MAX_VALUE) {
            ctx.report(MapIoIssue.at(IssueCode.MALFORMED_NODE, "house id " + rawHouseId + " out of range; ignored", pos));
        } else if (rawHouseId > 0) {
            houseId = OptionalInt.of((int) rawHouseId);
        }

        ctx.guard().countTile();
        Tile tile = new Tile(pos);
        readTileAttributes(in, tile, ctx);
        return new TileFrame(kind, tile, houseId);
    }

    private static void readTileAttributes(PayloadReader in, Tile tile, DecodeContext ctx)
    {
        final Position pos = tile.position();
        while (in.isReadable()) {
            final int start = in.position();
            final int tag = in.readU8();
            try {
                if (tag == OtbmAttribute.TILE_FLAGS.tag()) {
                    tile.setFlags((int) in.readU32());
                } else if (tag == OtbmAttribute.ITEM.tag()) {
                    final int rawId = in.readU16();
                    Item.Builder item = Item.builder(0);
                    ctx.resolveItemId(item, rawId, pos);
                    ctx.guard().countItem();
                    if (tile.ground().isEmpty()) {
                        tile.setGround(item.build());
                    } else {
                        tile.addItem(item.build());
                    }
                } else {
                    tile.setOpaqueRemainder(in.takeRemainderFrom(start));
                    ctx.report(MapIoIssue.at(IssueCode.UNKNOWN_ATTRIBUTE,
                            String.format("unknown tile attribute 0x%02X; remaining bytes kept verbatim", tag), pos));
                    return;
                }
            }
            catch (TruncatedPayloadException e) {
                tile.setOpaqueRemainder(in.takeRemainderFrom(start));
                ctx.report(MapIoIssue.at(IssueCode.MALFORMED_ATTRIBUTE,
                        String.format("tile attribute 0x%02X is cut short; remaining bytes kept verbatim", tag), pos));
                return;
            }
        }
    }

    static DecodeFrame tileZone(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        TileFrame tile = (TileFrame) parent;
        PayloadReader in = new PayloadReader(node.payload());
        try {
            final int count = in.readU16();
            for (int i = 0; i < count; i++) {
                int zone = in.readU16();
                if (zone != 0) {
                    tile.tile().addZone(zone);
                }
            }
        }
        catch (TruncatedPayloadException e) {
            ctx.report(MapIoIssue.at(IssueCode.MALFORMED_NODE, "zone list is cut short", tile.position()));
        }
        return new SimpleFrame(NodeKind.TILE_ZONE);
    }

    // =========================================================================
    // Items
    // =========================================================================

    static DecodeFrame item(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        ItemHolder holder = (ItemHolder) parent;
        final Position pos = holder.position();
        PayloadReader in = new PayloadReader(node.payload());
        if (in.readableBytes() < 2) {
            ctx.report(MapIoIssue.at(IssueCode.MALFORMED_NODE, "item node without an id; skipped", pos));
            return SkipFrame.INSTANCE;
        }

        final int rawId = in.readU16();
        Item.Builder item = Item.builder(0);
        final int id = ctx.resolveItemId(item, rawId, pos);
        ctx.guard().countItem();

        if (ctx.hasInlineSubtype(id) && in.isReadable()) {
            item.count(in.readU8());
        }
        ItemAttributeReader.read(in, item, ctx, pos);
        return new ItemFrame(holder, item);
    }

    // =========================================================================
    // Towns and waypoints
    // =========================================================================

    static DecodeFrame towns(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx) {
        return new SimpleFrame(NodeKind.TOWNS);
    }

    static DecodeFrame town(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        PayloadReader in = new PayloadReader(node.payload());
        try {
            long id = in.readU32();
            String name = in.readString();
            Position temple = in.readPosition();
            if (id > Integer.MAX_VALUE) {
                ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "town id " + id + " out of range; skipped"));
            } else {
                ctx.map().putTown(new Town((int) id, name, temple));
            }
        }
        catch (TruncatedPayloadException e) {
            ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "town payload is cut short; skipped"));
        }
        return new SimpleFrame(NodeKind.TOWN);
    }

    static DecodeFrame waypoints(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx) {
        return new SimpleFrame(NodeKind.WAYPOINTS);
    }

    static DecodeFrame waypoint(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        PayloadReader in = new PayloadReader(node.payload());
        try {
            String name = in.readString();
            Position pos = in.readPosition();
            ctx.map().putWaypoint(new Waypoint(name, pos));
        }
        catch (TruncatedPayloadException e) {
            ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "waypoint payload is cut short; skipped"));
        }
        return new SimpleFrame(NodeKind.WAYPOINT);
    }

    // =========================================================================
    // Legacy spawns
    // =========================================================================

    static DecodeFrame spawns(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx) {
        return new SimpleFrame(NodeKind.SPAWNS);
    }

    static DecodeFrame spawnArea(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        PayloadReader in = new PayloadReader(node.payload());
        try {
            Position center = in.readPosition();
            int radius = in.readU16();
            return new SpawnAreaFrame(center, radius);
        }
        catch (TruncatedPayloadException e) {
            ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "spawn area payload is cut short; skipped"));
            return SkipFrame.INSTANCE;
        }
    }

    static DecodeFrame monster(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        SpawnAreaFrame area = (SpawnAreaFrame) parent;
        PayloadReader in = new PayloadReader(node.payload());
        try {
            String name = in.readString();
            int dx = in.readI16();
            int dy = in.readI16();
            long interval = in.readU32();
            area.add(new SpawnEntry(name, dx, dy, (int) Math.min(interval, Integer.MAX_VALUE)));
        }
        catch (TruncatedPayloadException e) {
            ctx.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "spawn creature payload is cut short; skipped"));
        }
        return new SimpleFrame(NodeKind.MONSTER);
    }
}
