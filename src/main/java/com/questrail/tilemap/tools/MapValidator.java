package com.questrail.tilemap.tools;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.House;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.SpawnArea;
import com.questrail.tilemap.api.SpawnEntry;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.api.Town;
import com.questrail.tilemap.api.Waypoint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MapValidator
 * =============================================================================
 * Inspects an assembled {@link GameMap} for references and positions that do
 * not hold together.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>map dimensions, tiles outside the declared bounds</li>
 *   <li>tiles referencing a house that is not defined</li>
 *   <li>items that still carry a placeholder id from loading</li>
 *   <li>town ids and temple positions</li>
 *   <li>waypoint names and positions</li>
 *   <li>house ids, towns, entries, and houses without tiles</li>
 *   <li>spawn centers, radii and creature names</li>
 * </ul>
 *
 * <p>Findings that would repeat per tile are aggregated into one issue with
 * a count and the first position. The validator never modifies the map.</p>
 */
public final class MapValidator
{
    public static final int DEFAULT_MAX_Z = MapHeader.MAX_FLOOR;

    private static final int SAMPLE_SIZE = 5;

    private final int maxZ;

    public MapValidator() {
        this(DEFAULT_MAX_Z);
    }

    public MapValidator(int maxZ) {
        if (maxZ < 0 || maxZ > Position.MAX_Z) {
            throw new IllegalArgumentException("maxZ out of range: " + maxZ);
        }
        this.maxZ = maxZ;
    }

    public ValidationResult validate(GameMap map)
    {
        ValidationResult result = new ValidationResult();
        validateHeader(map, result);
        validateTiles(map, result);
        validateTowns(map, result);
        validateWaypoints(map, result);
        validateHouses(map, result);
        validateSpawns(map, result);
        return result;
    }

    private boolean inBounds(MapHeader header, Position p) {
        return header.containsColumn(p) && p.z() <= maxZ;
    }

    private static void add(ValidationResult result, ValidationSeverity severity, String code, String message,
                            Position at) {
        result.add(new ValidationIssue(severity, code, message, Optional.ofNullable(at)));
    }

    // =========================================================================
    // Header and tiles
    // =========================================================================

    private static void validateHeader(GameMap map, ValidationResult result) {
        MapHeader h = map.header();
        if (h.width() <= 0 || h.height() <= 0) {
            add(result, ValidationSeverity.ERROR, "MAP_DIMENSIONS_INVALID",
                    "map dimensions must be positive, found " + h.width() + "x" + h.height(), null);
        }
    }

    private void validateTiles(GameMap map, ValidationResult result)
    {
        List<Position> outOfBounds = new ArrayList<>();
        List<Position> placeholders = new ArrayList<>();
        long placeholderItems = 0;
        Deque<Item> pending = new ArrayDeque<>();

        for (Tile tile : map.tiles()) {
            if (!inBounds(map.header(), tile.position())) {
                outOfBounds.add(tile.position());
            }

            tile.ground().ifPresent(pending::push);
            tile.items().forEach(pending::push);
            int unresolved = 0;
            while (!pending.isEmpty()) {
                Item item = pending.pop();
                if (item.unresolvedId().isPresent()) {
                    unresolved++;
                }
                item.contents().forEach(pending::push);
            }
            if (unresolved > 0) {
                placeholders.add(tile.position());
                placeholderItems += unresolved;
            }
        }

        if (!outOfBounds.isEmpty()) {
            outOfBounds.sort(null);
            add(result, ValidationSeverity.ERROR, "TILE_OUT_OF_BOUNDS",
                    outOfBounds.size() + " tile(s) outside the map bounds, e.g. " + sample(outOfBounds),
                    outOfBounds.get(0));
        }
        if (!placeholders.isEmpty()) {
            placeholders.sort(null);
            add(result, ValidationSeverity.ERROR, "PLACEHOLDER_ITEM",
                    placeholderItems + " item(s) on " + placeholders.size()
                            + " tile(s) have no known item type, e.g. " + sample(placeholders),
                    placeholders.get(0));
        }

        for (Integer houseId : map.danglingHouseIds()) {
            Position first = map.houseTiles(houseId).first();
            add(result, ValidationSeverity.ERROR, "HOUSE_ID_MISSING",
                    "house " + houseId + " is referenced by " + map.houseTiles(houseId).size()
                            + " tile(s) but not defined", first);
        }
    }

    private static String sample(List<Position> positions) {
        return positions.stream().limit(SAMPLE_SIZE).map(Position::toString).collect(Collectors.joining(", "));
    }

    // =========================================================================
    // Towns, waypoints, houses
    // =========================================================================

    private void validateTowns(GameMap map, ValidationResult result)
    {
        for (Town town : map.towns()) {
            if (town.id() <= 0) {
                add(result, ValidationSeverity.ERROR, "TOWN_ID_INVALID",
                        "town id must be positive, found " + town.id(), null);
            }
            if (!inBounds(map.header(), town.templePosition())) {
                add(result, ValidationSeverity.ERROR, "TOWN_TEMPLE_OUT_OF_BOUNDS",
                        "temple of town " + town.id() + " (" + town.name() + ") is outside the map bounds",
                        town.templePosition());
            }
        }
    }

    private void validateWaypoints(GameMap map, ValidationResult result)
    {
        for (Waypoint waypoint : map.waypoints()) {
            if (waypoint.name().isBlank()) {
                add(result, ValidationSeverity.WARNING, "WAYPOINT_EMPTY_NAME", "waypoint name is empty",
                        waypoint.position());
            }
            if (!inBounds(map.header(), waypoint.position())) {
                add(result, ValidationSeverity.WARNING, "WAYPOINT_OUT_OF_BOUNDS",
                        "waypoint '" + waypoint.name() + "' is outside the map bounds", waypoint.position());
            }
        }
    }

    private void validateHouses(GameMap map, ValidationResult result)
    {
        for (House house : map.houses()) {
            if (map.houseTiles(house.id()).isEmpty()) {
                add(result, ValidationSeverity.WARNING, "HOUSE_UNUSED",
                        "house " + house.id() + " (" + house.name() + ") has no tiles", null);
            }
            if (house.townId() != 0 && map.town(house.townId()).isEmpty()) {
                add(result, ValidationSeverity.WARNING, "HOUSE_TOWN_MISSING",
                        "house " + house.id() + " belongs to town " + house.townId() + ", which is not defined", null);
            }
            if (house.entryPosition().isPresent()) {
                Position entry = house.entryPosition().get();
                if (!inBounds(map.header(), entry)) {
                    add(result, ValidationSeverity.WARNING, "HOUSE_ENTRY_OUT_OF_BOUNDS",
                            "entry of house " + house.id() + " is outside the map bounds", entry);
                } else if (map.tile(entry).isEmpty()) {
                    add(result, ValidationSeverity.WARNING, "HOUSE_ENTRY_MISSING_TILE",
                            "entry of house " + house.id() + " has no tile", entry);
                }
            }
        }
    }

    // =========================================================================
    // Spawns
    // =========================================================================

    private void validateSpawns(GameMap map, ValidationResult result)
    {
        for (SpawnArea area : map.spawnAreas()) {
            Position center = area.center();
            if (!inBounds(map.header(), center)) {
                add(result, ValidationSeverity.ERROR, "SPAWN_OUT_OF_BOUNDS",
                        area.kind() + " spawn center is outside the map bounds", center);
            }
            if (area.radius() < 0) {
                add(result, ValidationSeverity.ERROR, "SPAWN_RADIUS_INVALID",
                        "spawn radius must not be negative, found " + area.radius(), center);
            }
            for (SpawnEntry entry : area.entries()) {
                if (entry.creatureName().isBlank()) {
                    add(result, ValidationSeverity.WARNING, "SPAWN_EMPTY_NAME",
                            "spawn entry has an empty creature name", center);
                }
            }
        }
    }
}
