package com.questrail.tilemap.tools;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.House;
import com.questrail.tilemap.api.IdSpace;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.SpawnArea;
import com.questrail.tilemap.api.SpawnEntry;
import com.questrail.tilemap.api.SpawnKind;
import com.questrail.tilemap.api.Town;
import com.questrail.tilemap.api.UnresolvedItemId;
import com.questrail.tilemap.api.Waypoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class MapValidatorTest
{
    private final MapValidator validator = new MapValidator();

    private static GameMap emptyMap() {
        return new GameMap(MapHeader.builder().withDimensions(100, 100).build());
    }

    private static GameMap cleanMap() {
        GameMap map = emptyMap();
        map.getOrCreateTile(Position.of(10, 10, 7)).setGround(Item.of(100));
        map.assignHouse(Position.of(11, 10, 7), OptionalInt.of(1));
        map.putHouse(new House(1, "Main Street 1", 1, 500, Position.of(11, 10, 7), false));
        map.putTown(new Town(1, "Thais", Position.of(10, 10, 7)));
        map.putWaypoint(new Waypoint("temple", Position.of(10, 10, 7)));
        map.addSpawnArea(new SpawnArea(SpawnKind.MONSTER, Position.of(20, 20, 7), 3,
                List.of(new SpawnEntry("Rat", 0, 1, 60))));
        return map;
    }

    @Test
    void consistentMapHasNoIssues() {
        ValidationResult result = validator.validate(cleanMap());
        assertTrue(result.issues().isEmpty(), () -> result.issues().toString());
        assertFalse(result.hasErrors());
    }

    // ---------------------------------------------------------------------
    // Tiles
    // ---------------------------------------------------------------------

    /**
     * Tiles outside the bounds are reported once, with a count and the first
     * position.
     */
    @Test
    void tilesOutsideBoundsAreAggregated() {
        GameMap map = emptyMap();
        map.getOrCreateTile(Position.of(150, 10, 7));
        map.getOrCreateTile(Position.of(5, 120, 7));
        map.getOrCreateTile(Position.of(1, 1, 16));

        ValidationResult result = validator.validate(map);

        assertEquals(1, result.errors().size());
        ValidationIssue issue = result.errors().get(0);
        assertEquals("TILE_OUT_OF_BOUNDS", issue.code());
        assertTrue(issue.message().startsWith("3 tile(s)"));
        assertEquals(Position.of(150, 10, 7), issue.position().orElseThrow());
    }

    @Test
    void floorLimitIsConfigurable() {
        GameMap map = emptyMap();
        map.getOrCreateTile(Position.of(1, 1, 16));
        assertFalse(new MapValidator(255).validate(map).hasErrors());
        assertThrows(IllegalArgumentException.class, () -> new MapValidator(256));
    }

    @Test
    void placeholderItemsAreReported() {
        GameMap map = emptyMap();
        map.getOrCreateTile(Position.of(1, 1, 7)).addItem(Item.builder(1987)
                .addContent(Item.builder(0).unresolvedId(new UnresolvedItemId(9999, IdSpace.CLIENT)).build())
                .build());

        ValidationResult result = validator.validate(map);

        assertTrue(result.hasIssue("PLACEHOLDER_ITEM"));
        assertTrue(result.errors().get(0).message().startsWith("1 item(s) on 1 tile(s)"));
    }

    @Test
    void undefinedHouseIsReportedOncePerId() {
        GameMap map = emptyMap();
        map.assignHouse(Position.of(3, 3, 7), OptionalInt.of(5));
        map.assignHouse(Position.of(2, 3, 7), OptionalInt.of(5));

        ValidationResult result = validator.validate(map);

        assertEquals(1, result.errors().size());
        assertEquals("HOUSE_ID_MISSING", result.errors().get(0).code());
        assertEquals(Position.of(2, 3, 7), result.errors().get(0).position().orElseThrow());
    }

    // ---------------------------------------------------------------------
    // Towns, waypoints, houses, spawns
    // ---------------------------------------------------------------------

    @Test
    void badTownIsReported() {
        GameMap map = emptyMap();
        map.putTown(new Town(0, "Nowhere", Position.of(200, 200, 7)));

        ValidationResult result = validator.validate(map);

        assertTrue(result.hasIssue("TOWN_ID_INVALID"));
        assertTrue(result.hasIssue("TOWN_TEMPLE_OUT_OF_BOUNDS"));
    }

    @Test
    void waypointProblemsAreWarnings() {
        GameMap map = emptyMap();
        map.putWaypoint(new Waypoint(" ", Position.of(1, 1, 7)));
        map.putWaypoint(new Waypoint("far", Position.of(500, 1, 7)));

        ValidationResult result = validator.validate(map);

        assertFalse(result.hasErrors());
        assertEquals(2, result.warnings().size());
        assertTrue(result.hasIssue("WAYPOINT_EMPTY_NAME"));
        assertTrue(result.hasIssue("WAYPOINT_OUT_OF_BOUNDS"));
    }

    @Test
    void houseProblemsAreWarnings() {
        GameMap map = emptyMap();
        map.putHouse(new House(7, "Empty Lot", 3, 0, Position.of(2, 2, 7), false));
        map.putHouse(new House(8, "Far Away", 0, 0, Position.of(300, 2, 7), true));

        ValidationResult result = validator.validate(map);

        assertFalse(result.hasErrors());
        assertTrue(result.hasIssue("HOUSE_UNUSED"));
        assertTrue(result.hasIssue("HOUSE_TOWN_MISSING"));
        assertTrue(result.hasIssue("HOUSE_ENTRY_MISSING_TILE"));
        assertTrue(result.hasIssue("HOUSE_ENTRY_OUT_OF_BOUNDS"));
    }

    @Test
    void spawnProblemsAreReported() {
        GameMap map = emptyMap();
        map.addSpawnArea(new SpawnArea(SpawnKind.NPC, Position.of(100, 1, 7), -1,
                List.of(new SpawnEntry("", 0, 0, 30))));

        ValidationResult result = validator.validate(map);

        assertTrue(result.hasIssue("SPAWN_OUT_OF_BOUNDS"));
        assertTrue(result.hasIssue("SPAWN_RADIUS_INVALID"));
        assertTrue(result.hasIssue("SPAWN_EMPTY_NAME"));
        assertEquals(2, result.errors().size());
    }

    @Test
    void validationLeavesTheMapUntouched() {
        GameMap map = cleanMap();
        GameMap copy = cleanMap();
        validator.validate(map);
        assertEquals(copy, map);
    }
}
