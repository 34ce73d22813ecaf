package com.questrail.tilemap.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tile
 * -----------------------------------------------------------------------------
 * The contents of one map position.
 *
 * <p>A tile holds at most one ground item, an ordered stack of further items,
 * a raw flag word, an optional house id, zone ids, and any data that was not
 * understood when it was loaded. Items are immutable; the tile itself is the
 * unit of mutation.</p>
 *
 * <p>The house id is assigned through {@link GameMap#assignHouse} so that the
 * map's house membership index never disagrees with its tiles.</p>
 */
public final class Tile
{
    private static final byte[] NO_BYTES = new byte[0];

    private final Position position;
    private Item ground;
    private final List<Item> items = new ArrayList<>();
    private int flags;
    private Integer houseId;
    private final SortedSet<Integer> zones = new TreeSet<>();
    private byte[] opaqueRemainder = NO_BYTES;
    private final List<OpaqueNode> opaqueNodes = new ArrayList<>();

    public Tile(Position position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public Position position() {
        return position;
    }

    public Optional<Item> ground() {
        return Optional.ofNullable(ground);
    }

    public void setGround(Item ground) {
        this.ground = ground;
    }

    /**
     * Items stacked on the ground, bottom first.
     */
    public List<Item> items() {
        return Collections.unmodifiableList(items);
    }

    public void addItem(Item item) {
        items.add(Objects.requireNonNull(item, "item"));
    }

    public void setItems(List<Item> replacement) {
        items.clear();
        for (Item item : replacement) {
            addItem(item);
        }
    }

    public boolean isEmpty() {
        return ground == null && items.isEmpty();
    }

    /**
     * Number of items on this tile, container contents included.
     */
    public int itemCount() {
        int n = ground == null ? 0 : ground.subtreeSize();
        for (Item item : items) {
            n += item.subtreeSize();
        }
        return n;
    }

    public int flags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public boolean hasFlag(TileFlag flag) {
        return (flags & flag.mask()) != 0;
    }

    public void setFlag(TileFlag flag, boolean enabled) {
        flags = enabled ? (flags | flag.mask()) : (flags & ~flag.mask());
    }

    public OptionalInt houseId() {
        return houseId == null ? OptionalInt.empty() : OptionalInt.of(houseId);
    }

    void setHouseId(Integer houseId) {
        this.houseId = houseId;
    }

    public SortedSet<Integer> zones() {
        return Collections.unmodifiableSortedSet(zones);
    }

    public void addZone(int zoneId) {
        if (zoneId < 0 || zoneId > 0xFFFF) {
            throw new IllegalArgumentException("zone id out of range: " + zoneId);
        }
        zones.add(zoneId);
    }

    public void clearZones() {
        zones.clear();
    }

    public byte[] opaqueRemainder() {
        return opaqueRemainder.length == 0 ? NO_BYTES : opaqueRemainder.clone();
    }

    public void setOpaqueRemainder(byte[] remainder) {
        this.opaqueRemainder = remainder == null || remainder.length == 0 ? NO_BYTES : remainder.clone();
    }

    public List<OpaqueNode> opaqueNodes() {
        return Collections.unmodifiableList(opaqueNodes);
    }

    public void addOpaqueNode(OpaqueNode node) {
        opaqueNodes.add(Objects.requireNonNull(node, "node"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tile)) return false;
        Tile that = (Tile) o;
        return flags == that.flags
                && position.equals(that.position)
                && Objects.equals(ground, that.ground)
                && items.equals(that.items)
                && Objects.equals(houseId, that.houseId)
                && zones.equals(that.zones)
                && Arrays.equals(opaqueRemainder, that.opaqueRemainder)
                && opaqueNodes.equals(that.opaqueNodes);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(position, ground, items, flags, houseId, zones, opaqueNodes);
        return 31 * h + Arrays.hashCode(opaqueRemainder);
    }

    @Override
    public String toString() {
        return "Tile{" + position
                + ", ground=" + (ground == null ? "-" : ground.id())
                + ", items=" + items.size()
                + (houseId == null ? "" : ", house=" + houseId)
                + '}';
    }
}
