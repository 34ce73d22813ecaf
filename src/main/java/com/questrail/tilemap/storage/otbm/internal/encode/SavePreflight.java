package com.questrail.tilemap.storage.otbm.internal.encode;

import com.questrail.tilemap.api.AttributeMapEntry;
import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Latin1;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.api.Town;
import com.questrail.tilemap.api.UnresolvedItemId;
import com.questrail.tilemap.api.Waypoint;
import com.questrail.tilemap.storage.otbm.error.InvalidMapDataException;
import com.questrail.tilemap.storage.otbm.error.UnmappableIdException;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.report.UnmappableItem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SavePreflight
 * -----------------------------------------------------------------------------
 * Checks a map against a save target before any byte is written.
 *
 * <p>Every item, container contents included, must have an on-disk id in the
 * target's id space; otherwise the save fails with all offending positions
 * listed. Every text field must be representable in Latin-1; otherwise the save
 * fails naming where the text sits. Data the target version cannot store (tile zones before V6, item
 * tiers before V7, in-map spawn areas) is reported as
 * {@link IssueCode#DATA_DROPPED}, once per kind.</p>
 */
public final class SavePreflight
{
    private static final int MAX_LISTED = 10;

    private final OtbmVersion target;
    private final ItemIdEncoder ids;

    public SavePreflight(OtbmVersion target, ItemIdEncoder ids) {
        this.target = Objects.requireNonNull(target, "target");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * @throws UnmappableIdException if any item cannot be written
     * @throws InvalidMapDataException if any text field is not Latin-1
     */
    public void check(GameMap map, IssueCollector issues)
    {
        List<UnmappableItem> unmappable = new ArrayList<>();
        List<String> badText = new ArrayList<>();
        checkMapText(map, badText);
        int tilesWithZones = 0;
        int itemsWithTier = 0;
        Deque<Item> pending = new ArrayDeque<>();

        for (Tile tile : map.tiles()) {
            if (!tile.zones().isEmpty()) {
                tilesWithZones++;
            }
            tile.ground().ifPresent(pending::push);
            tile.items().forEach(pending::push);

            final Position pos = tile.position();
            while (!pending.isEmpty()) {
                Item item = pending.pop();
                if (ids.encode(item).isEmpty()) {
                    unmappable.add(new UnmappableItem(pos,
                            item.unresolvedId().map(UnresolvedItemId::rawId).orElse(item.id())));
                }
                if (item.tier().isPresent()) {
                    itemsWithTier++;
                }
                checkItemText(item, pos, badText);
                item.contents().forEach(pending::push);
            }
        }

        if (!unmappable.isEmpty()) {
            unmappable.sort((a, b) -> a.position().compareTo(b.position()));
            throw new UnmappableIdException(unmappable.size() + " item(s) cannot be written with "
                    + ids.target().name().toLowerCase(Locale.ROOT) + " ids, first at " + unmappable.get(0).position(),
                    unmappable);
        }
        if (!badText.isEmpty()) {
            throw new InvalidMapDataException(badText.size() + " text field(s) cannot be stored as Latin-1: "
                    + String.join(", ", badText.subList(0, Math.min(MAX_LISTED, badText.size())))
                    + (badText.size() > MAX_LISTED ? ", ..." : ""));
        }

        if (tilesWithZones > 0 && !target.supportsTileZones()) {
            issues.report(MapIoIssue.of(IssueCode.DATA_DROPPED,
                    "zones of " + tilesWithZones + " tile(s) are not stored by map version " + target));
        }
        if (itemsWithTier > 0 && !target.supportsItemTier()) {
            issues.report(MapIoIssue.of(IssueCode.DATA_DROPPED,
                    "tier of " + itemsWithTier + " item(s) is not stored by map version " + target));
        }
        if (!map.spawnAreas().isEmpty()) {
            issues.report(MapIoIssue.of(IssueCode.DATA_DROPPED,
                    map.spawnAreas().size() + " spawn area(s) belong in the spawn file and are not written to the map"));
        }
    }

    private static void checkMapText(GameMap map, List<String> badText)
    {
        MapHeader h = map.header();
        checkText(h.description(), "map description", badText);
        checkText(h.spawnFile(), "spawn file name", badText);
        checkText(h.houseFile(), "house file name", badText);
        checkText(h.npcSpawnFile(), "npc spawn file name", badText);
        checkText(h.zoneFile(), "zone file name", badText);
        for (Town town : map.towns()) {
            checkText(town.name(), "name of town " + town.id(), badText);
        }
        for (Waypoint waypoint : map.waypoints()) {
            checkText(waypoint.name(), "waypoint name \"" + waypoint.name() + "\"", badText);
        }
    }

    private static void checkItemText(Item item, Position pos, List<String> badText)
    {
        String where = " of item " + item.id() + " at " + pos;
        item.text().ifPresent(v -> checkText(v, "text" + where, badText));
        item.description().ifPresent(v -> checkText(v, "description" + where, badText));
        item.writtenBy().ifPresent(v -> checkText(v, "writer" + where, badText));
        for (AttributeMapEntry entry : item.attributeMap()) {
            checkText(entry.key(), "attribute key" + where, badText);
        }
    }

    private static void checkText(String value, String location, List<String> badText) {
        if (value != null && !Latin1.canEncode(value)) {
            badText.add(location);
        }
    }
}
