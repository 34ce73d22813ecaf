package com.questrail.tilemap.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * GameMap
 * =============================================================================
 * The in-memory world: a sparse collection of tiles plus map-wide entities.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>Tiles are keyed by {@link Position}; at most one tile exists per position.</li>
 *   <li>Towns are keyed by id, waypoints by name, houses by id.</li>
 *   <li>The house membership index is maintained here. A tile's house id can
 *       only change through {@link #assignHouse}, so every position listed by
 *       {@link #houseTiles(int)} carries the matching id.</li>
 * </ul>
 *
 * <p>A map is owned by one thread at a time. Loading produces a fresh instance;
 * saving only reads it.</p>
 */
public final class GameMap
{
    private static final byte[] NO_BYTES = new byte[0];

    private MapHeader header;
    private final Map<Position, Tile> tiles = new HashMap<>();
    private final Map<Integer, SortedSet<Position>> houseIndex = new TreeMap<>();
    private final Map<Integer, House> houses = new TreeMap<>();
    private final Map<Integer, Town> towns = new TreeMap<>();
    private final Map<String, Waypoint> waypoints = new LinkedHashMap<>();
    private final List<SpawnArea> spawnAreas = new ArrayList<>();
    private final List<OpaqueNode> opaqueNodes = new ArrayList<>();
    private byte[] opaqueRemainder = NO_BYTES;

    public GameMap(MapHeader header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public MapHeader header() {
        return header;
    }

    public void setHeader(MapHeader header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    // =========================================================================
    // Tiles
    // =========================================================================

    public Optional<Tile> tile(Position position) {
        return Optional.ofNullable(tiles.get(position));
    }

    public Tile getOrCreateTile(Position position) {
        return tiles.computeIfAbsent(position, Tile::new);
    }

    /**
     * Installs a tile, replacing any tile at the same position.
     *
     * @return the replaced tile, if there was one
     */
    public Optional<Tile> putTile(Tile tile) {
        Objects.requireNonNull(tile, "tile");
        Tile previous = tiles.put(tile.position(), tile);
        if (previous != null && previous != tile) {
            unindex(previous);
        }
        index(tile);
        return Optional.ofNullable(previous == tile ? null : previous);
    }

    public Optional<Tile> removeTile(Position position) {
        Tile removed = tiles.remove(position);
        if (removed != null) {
            unindex(removed);
        }
        return Optional.ofNullable(removed);
    }

    public Collection<Tile> tiles() {
        return Collections.unmodifiableCollection(tiles.values());
    }

    public int tileCount() {
        return tiles.size();
    }

    public long itemCount() {
        long n = 0;
        for (Tile tile : tiles.values()) {
            n += tile.itemCount();
        }
        return n;
    }

    // =========================================================================
    // Houses
    // =========================================================================

    /**
     * Sets or clears the house id of the tile at {@code position}, creating the
     * tile if needed, and keeps the membership index in step.
     */
    public void assignHouse(Position position, OptionalInt houseId) {
        Tile tile = getOrCreateTile(position);
        unindex(tile);
        if (houseId.isPresent()) {
            if (houseId.getAsInt() <= 0) {
                throw new IllegalArgumentException("house id must be positive: " + houseId.getAsInt());
            }
            tile.setHouseId(houseId.getAsInt());
        } else {
            tile.setHouseId(null);
        }
        index(tile);
    }

    public void putHouse(House house) {
        houses.put(house.id(), Objects.requireNonNull(house, "house"));
    }

    public Optional<House> house(int id) {
        return Optional.ofNullable(houses.get(id));
    }

    public Collection<House> houses() {
        return Collections.unmodifiableCollection(houses.values());
    }

    /**
     * Positions of the tiles carrying {@code houseId}, in position order.
     */
    public SortedSet<Position> houseTiles(int houseId) {
        SortedSet<Position> members = houseIndex.get(houseId);
        return members == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(members);
    }

    /**
     * House ids referenced by tiles for which no {@link House} is defined.
     */
    public SortedSet<Integer> danglingHouseIds() {
        SortedSet<Integer> dangling = new TreeSet<>();
        for (Integer id : houseIndex.keySet()) {
            if (!houses.containsKey(id)) {
                dangling.add(id);
            }
        }
        return dangling;
    }

    private void index(Tile tile) {
        OptionalInt id = tile.houseId();
        if (id.isPresent()) {
            houseIndex.computeIfAbsent(id.getAsInt(), k -> new TreeSet<>()).add(tile.position());
        }
    }

    private void unindex(Tile tile) {
        OptionalInt id = tile.houseId();
        if (id.isPresent()) {
            SortedSet<Position> members = houseIndex.get(id.getAsInt());
            if (members != null) {
                members.remove(tile.position());
                if (members.isEmpty()) {
                    houseIndex.remove(id.getAsInt());
                }
            }
        }
    }

    // =========================================================================
    // Towns, waypoints, spawns
    // =========================================================================

    public void putTown(Town town) {
        towns.put(town.id(), Objects.requireNonNull(town, "town"));
    }

    public Optional<Town> town(int id) {
        return Optional.ofNullable(towns.get(id));
    }

    public Collection<Town> towns() {
        return Collections.unmodifiableCollection(towns.values());
    }

    public void putWaypoint(Waypoint waypoint) {
        waypoints.put(waypoint.name(), Objects.requireNonNull(waypoint, "waypoint"));
    }

    public Optional<Waypoint> waypoint(String name) {
        return Optional.ofNullable(waypoints.get(name));
    }

    public Collection<Waypoint> waypoints() {
        return Collections.unmodifiableCollection(waypoints.values());
    }

    public void addSpawnArea(SpawnArea area) {
        spawnAreas.add(Objects.requireNonNull(area, "area"));
    }

    public List<SpawnArea> spawnAreas() {
        return Collections.unmodifiableList(spawnAreas);
    }

    // =========================================================================
    // Preserved unknown data
    // =========================================================================

    public List<OpaqueNode> opaqueNodes() {
        return Collections.unmodifiableList(opaqueNodes);
    }

    public void addOpaqueNode(OpaqueNode node) {
        opaqueNodes.add(Objects.requireNonNull(node, "node"));
    }

    public byte[] opaqueRemainder() {
        return opaqueRemainder.length == 0 ? NO_BYTES : opaqueRemainder.clone();
    }

    public void setOpaqueRemainder(byte[] remainder) {
        this.opaqueRemainder = remainder == null || remainder.length == 0 ? NO_BYTES : remainder.clone();
    }

    /**
     * Set of ids of the houses that no tile references.
     */
    public Set<Integer> unusedHouseIds() {
        Set<Integer> unused = new TreeSet<>(houses.keySet());
        unused.removeAll(houseIndex.keySet());
        return unused;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameMap)) return false;
        GameMap that = (GameMap) o;
        return header.equals(that.header)
                && tiles.equals(that.tiles)
                && houses.equals(that.houses)
                && towns.equals(that.towns)
                && new TreeMap<>(waypoints).equals(new TreeMap<>(that.waypoints))
                && spawnAreas.equals(that.spawnAreas)
                && opaqueNodes.equals(that.opaqueNodes)
                && Arrays.equals(opaqueRemainder, that.opaqueRemainder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, tiles.size(), houses.keySet(), towns.keySet(), waypoints.keySet());
    }

    @Override
    public String toString() {
        return "GameMap{" + header.width() + "x" + header.height()
                + ", tiles=" + tiles.size()
                + ", houses=" + houses.size()
                + ", towns=" + towns.size()
                + ", waypoints=" + waypoints.size()
                + '}';
    }
}
