package com.questrail.tilemap.storage.otbm.internal.encode;

import com.questrail.tilemap.api.AttributeMapEntry;
import com.questrail.tilemap.api.AttributeValueType;
import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.OpaqueNode;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.api.Town;
import com.questrail.tilemap.api.Waypoint;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.storage.otbm.codec.OtbmNodeWriter;
import com.questrail.tilemap.storage.otbm.codec.PayloadWriter;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.format.OtbmAttribute;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.SaveStatistics;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * GameMapEncoder
 * =============================================================================
 * Writes a {@link GameMap} as a node tree in one structural version.
 *
 * <h2>Layout</h2>
 * <ol>
 *   <li>root: version, size, item database version</li>
 *   <li>map data: description and external file names, then</li>
 *   <li>tile areas keyed by {@code (x & 0xFF00, y & 0xFF00, z)}, in ascending
 *       (z, base y, base x); tiles inside an area by (y, x)</li>
 *   <li>towns by id, waypoints by name ignoring case, each container only
 *       when non-empty</li>
 *   <li>preserved unknown map-data children</li>
 * </ol>
 *
 * <p>Item ids must have passed {@link SavePreflight} for the same target;
 * the encoder does not re-validate them. Item containers and preserved
 * subtrees are written with an explicit stack, as they are read.</p>
 */
public final class GameMapEncoder
{
    private static final Comparator<Tile> TILE_ORDER =
            Comparator.comparing((Tile t) -> t.position().y()).thenComparing(t -> t.position().x());

    private static final Comparator<Waypoint> WAYPOINT_ORDER =
            Comparator.comparing(Waypoint::name, String.CASE_INSENSITIVE_ORDER).thenComparing(Waypoint::name);

    // Item payload offsets: u16 id, then the V1 inline subtype byte.
    private static final int ITEM_ID_END = 2;
    private static final int INLINE_SUBTYPE_END = 3;

    private final OtbmVersion version;
    private final ItemIdEncoder ids;
    private final ItemDatabase database;
    private final PayloadWriter payload = new PayloadWriter();

    private int tileAreas;
    private int tiles;
    private long items;

    /**
     * @param database item database, used for the inline subtype of V1 items
     */
    public GameMapEncoder(OtbmVersion version, ItemIdEncoder ids, Optional<ItemDatabase> database) {
        this.version = Objects.requireNonNull(version, "version");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.database = database.orElse(null);
    }

    public SaveStatistics encode(GameMap map, OtbmNodeWriter out) throws IOException
    {
        MapHeader header = map.header();

        out.startNode(NodeKind.ROOT.type());
        out.writePayload(payload.reset()
                .writeU32(version.wireValue())
                .writeU16(header.width())
                .writeU16(header.height())
                .writeU32(header.itemsMajorVersion())
                .writeU32(header.itemsMinorVersion())
                .toByteArray());

        out.startNode(NodeKind.MAP_DATA.type());
        out.writePayload(mapDataPayload(map));

        for (Map.Entry<AreaKey, List<Tile>> area : groupIntoAreas(map).entrySet()) {
            writeTileArea(area.getKey(), area.getValue(), out);
        }

        if (!map.towns().isEmpty()) {
            out.startNode(NodeKind.TOWNS.type());
            for (Town town : map.towns()) {
                out.startNode(NodeKind.TOWN.type());
                out.writePayload(payload.reset()
                        .writeU32(town.id())
                        .writeString(town.name())
                        .writePosition(town.templePosition())
                        .toByteArray());
                out.endNode();
            }
            out.endNode();
        }

        if (!map.waypoints().isEmpty()) {
            List<Waypoint> sorted = new ArrayList<>(map.waypoints());
            sorted.sort(WAYPOINT_ORDER);
            out.startNode(NodeKind.WAYPOINTS.type());
            for (Waypoint waypoint : sorted) {
                out.startNode(NodeKind.WAYPOINT.type());
                out.writePayload(payload.reset()
                        .writeString(waypoint.name())
                        .writePosition(waypoint.position())
                        .toByteArray());
                out.endNode();
            }
            out.endNode();
        }

        for (OpaqueNode node : map.opaqueNodes()) {
            writeOpaque(node, out);
        }

        out.endNode();
        out.endNode();
        return new SaveStatistics(out.bytesWritten(), tileAreas, tiles, items);
    }

    private byte[] mapDataPayload(GameMap map)
    {
        MapHeader h = map.header();
        payload.reset();
        writeStringAttribute(OtbmAttribute.DESCRIPTION, h.description());
        writeStringAttribute(OtbmAttribute.EXT_SPAWN_FILE, h.spawnFile());
        writeStringAttribute(OtbmAttribute.EXT_HOUSE_FILE, h.houseFile());
        writeStringAttribute(OtbmAttribute.EXT_SPAWN_NPC_FILE, h.npcSpawnFile());
        writeStringAttribute(OtbmAttribute.EXT_ZONE_FILE, h.zoneFile());
        payload.writeBytes(map.opaqueRemainder());
        return payload.toByteArray();
    }

    private void writeStringAttribute(OtbmAttribute attribute, String value) {
        if (value != null) {
            payload.writeU8(attribute.tag()).writeString(value);
        }
    }

    // =========================================================================
    // Tiles
    // =========================================================================

    private record AreaKey(int z, int baseY, int baseX) implements Comparable<AreaKey> {
        private static final Comparator<AreaKey> ORDER =
                Comparator.comparingInt(AreaKey::z).thenComparingInt(AreaKey::baseY).thenComparingInt(AreaKey::baseX);

        static AreaKey of(Tile tile) {
            return new AreaKey(tile.position().z(), tile.position().y() & 0xFF00, tile.position().x() & 0xFF00);
        }

        @Override
        public int compareTo(AreaKey other) {
            return ORDER.compare(this, other);
        }
    }

    private static Map<AreaKey, List<Tile>> groupIntoAreas(GameMap map) {
        Map<AreaKey, List<Tile>> areas = new TreeMap<>();
        for (Tile tile : map.tiles()) {
            areas.computeIfAbsent(AreaKey.of(tile), k -> new ArrayList<>()).add(tile);
        }
        return areas;
    }

    private void writeTileArea(AreaKey area, List<Tile> members, OtbmNodeWriter out) throws IOException
    {
        members.sort(TILE_ORDER);
        out.startNode(NodeKind.TILE_AREA.type());
        out.writePayload(payload.reset()
                .writeU16(area.baseX())
                .writeU16(area.baseY())
                .writeU8(area.z())
                .toByteArray());
        for (Tile tile : members) {
            writeTile(area, tile, out);
        }
        out.endNode();
        tileAreas++;
    }

    private void writeTile(AreaKey area, Tile tile, OtbmNodeWriter out) throws IOException
    {
        final boolean house = tile.houseId().isPresent();
        out.startNode(house ? NodeKind.HOUSETILE.type() : NodeKind.TILE.type());

        payload.reset()
                .writeU8(tile.position().x() - area.baseX())
                .writeU8(tile.position().y() - area.baseY());
        if (house) {
            payload.writeU32(tile.houseId().getAsInt());
        }
        if (tile.flags() != 0) {
            payload.writeU8(OtbmAttribute.TILE_FLAGS.tag()).writeU32(tile.flags() & 0xFFFF_FFFFL);
        }

        Item ground = tile.ground().orElse(null);
        boolean compactGround = ground != null && version.allowsCompactGround() && ground.isPlain();
        if (compactGround) {
            payload.writeU8(OtbmAttribute.ITEM.tag()).writeU16(onDiskId(ground));
            items++;
        }
        payload.writeBytes(tile.opaqueRemainder());
        out.writePayload(payload.toByteArray());

        if (ground != null && !compactGround) {
            writeItem(ground, out);
        }
        for (Item item : tile.items()) {
            writeItem(item, out);
        }
        if (version.supportsTileZones() && !tile.zones().isEmpty()) {
            out.startNode(NodeKind.TILE_ZONE.type());
            payload.reset().writeU16(tile.zones().size());
            for (int zone : tile.zones()) {
                payload.writeU16(zone);
            }
            out.writePayload(payload.toByteArray());
            out.endNode();
        }
        for (OpaqueNode node : tile.opaqueNodes()) {
            writeOpaque(node, out);
        }
        out.endNode();
        tiles++;
    }

    // =========================================================================
    // Items
    // =========================================================================

    private void writeItem(Item root, OtbmNodeWriter out) throws IOException
    {
        Deque<Iterator<Item>> open = new ArrayDeque<>();
        startItem(root, out);
        open.push(root.contents().iterator());
        while (!open.isEmpty()) {
            Iterator<Item> children = open.peek();
            if (children.hasNext()) {
                Item child = children.next();
                startItem(child, out);
                open.push(child.contents().iterator());
            } else {
                out.endNode();
                open.pop();
            }
        }
    }

    private void startItem(Item item, OtbmNodeWriter out) throws IOException {
        out.startNode(NodeKind.ITEM.type());
        out.writePayload(itemPayload(item));
        items++;
    }

    private byte[] itemPayload(Item item)
    {
        payload.reset().writeU16(onDiskId(item));

        boolean inlineSubtype = version.hasInlineSubtype() && database != null
                && item.unresolvedId().isEmpty() && database.hasInlineSubtype(item.id());
        // The inline byte is positional: without a count it is only needed as
        // a placeholder when attributes follow, and is dropped again otherwise.
        if (inlineSubtype) {
            payload.writeU8(item.count().orElse(1));
        } else if (item.count().isPresent()) {
            payload.writeU8(OtbmAttribute.COUNT.tag()).writeU8(item.count().getAsInt());
        }

        if (item.charges().isPresent()) {
            int charges = item.charges().getAsInt();
            if (charges <= 0xFF) {
                payload.writeU8(OtbmAttribute.RUNE_CHARGES.tag()).writeU8(charges);
            } else {
                payload.writeU8(OtbmAttribute.CHARGES.tag()).writeU16(charges);
            }
        }
        item.actionId().ifPresent(v -> payload.writeU8(OtbmAttribute.ACTION_ID.tag()).writeU16(v));
        item.uniqueId().ifPresent(v -> payload.writeU8(OtbmAttribute.UNIQUE_ID.tag()).writeU16(v));
        item.text().ifPresent(v -> payload.writeU8(OtbmAttribute.TEXT.tag()).writeString(v));
        item.description().ifPresent(v -> payload.writeU8(OtbmAttribute.DESC.tag()).writeString(v));
        item.teleportDestination().ifPresent(v -> payload.writeU8(OtbmAttribute.TELE_DEST.tag()).writePosition(v));
        item.depotId().ifPresent(v -> payload.writeU8(OtbmAttribute.DEPOT_ID.tag()).writeU16(v));
        item.houseDoorId().ifPresent(v -> payload.writeU8(OtbmAttribute.HOUSEDOORID.tag()).writeU8(v));
        item.duration().ifPresent(v -> payload.writeU8(OtbmAttribute.DURATION.tag()).writeU32(v));
        item.decayingState().ifPresent(v -> payload.writeU8(OtbmAttribute.DECAYING_STATE.tag()).writeU8(v));
        item.writtenDate().ifPresent(v -> payload.writeU8(OtbmAttribute.WRITTENDATE.tag()).writeU32(v));
        item.writtenBy().ifPresent(v -> payload.writeU8(OtbmAttribute.WRITTENBY.tag()).writeString(v));
        item.sleeperGuid().ifPresent(v -> payload.writeU8(OtbmAttribute.SLEEPERGUID.tag()).writeU32(v));
        item.sleepStart().ifPresent(v -> payload.writeU8(OtbmAttribute.SLEEPSTART.tag()).writeU32(v));
        if (version.supportsItemTier()) {
            item.tier().ifPresent(v -> payload.writeU8(OtbmAttribute.TIER.tag()).writeU8(v));
        }

        if (!item.attributeMap().isEmpty()) {
            payload.writeU8(OtbmAttribute.ATTRIBUTE_MAP.tag()).writeU16(item.attributeMap().size());
            for (AttributeMapEntry entry : item.attributeMap()) {
                byte[] value = entry.value();
                payload.writeString(entry.key()).writeU8(entry.type().tag());
                if (entry.type() == AttributeValueType.STRING) {
                    payload.writeU32(value.length);
                }
                payload.writeBytes(value);
            }
        }

        payload.writeBytes(item.opaqueRemainder());
        if (inlineSubtype && item.count().isEmpty() && payload.size() == INLINE_SUBTYPE_END) {
            payload.truncate(ITEM_ID_END);
        }
        return payload.toByteArray();
    }

    private int onDiskId(Item item) {
        return ids.encode(item).orElseThrow(() ->
                new IllegalStateException("item " + item.id() + " has no " + ids.target() + " id; pre-flight skipped?"));
    }

    // =========================================================================
    // Preserved subtrees
    // =========================================================================

    private static void writeOpaque(OpaqueNode root, OtbmNodeWriter out) throws IOException
    {
        Deque<Iterator<OpaqueNode>> open = new ArrayDeque<>();
        out.startNode(root.type());
        out.writePayload(root.payload());
        open.push(root.children().iterator());
        while (!open.isEmpty()) {
            Iterator<OpaqueNode> children = open.peek();
            if (children.hasNext()) {
                OpaqueNode child = children.next();
                out.startNode(child.type());
                out.writePayload(child.payload());
                open.push(child.children().iterator());
            } else {
                out.endNode();
                open.pop();
            }
        }
    }
}
