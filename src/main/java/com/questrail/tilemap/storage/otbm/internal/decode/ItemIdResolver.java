package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.IdSpace;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.UnresolvedItemId;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.mapping.ItemIdTranslator;
import com.questrail.tilemap.storage.otbm.config.UnknownItemPolicy;
import com.questrail.tilemap.storage.otbm.error.UnmappableIdException;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.report.UnmappableItem;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ItemIdResolver
 * -----------------------------------------------------------------------------
 * Turns an item id read from disk into the ServerID held in memory.
 *
 * <h2>ClientID files</h2>
 * Every id goes through the item database translator. An id without a
 * mapping is handled by the {@link UnknownItemPolicy}; {@code KEEP} cannot
 * keep a client id as a server id, so it behaves as {@code PLACEHOLDER}.
 *
 * <h2>ServerID files</h2>
 * The id is kept. When an item database is available, ids it does not
 * contain are handled by the policy as well.
 */
public final class ItemIdResolver
{
    private final IdSpace space;
    private final ItemDatabase database;
    private final ItemIdTranslator translator;
    private final UnknownItemPolicy policy;
    private final int placeholderId;
    private final IssueCollector issues;

    /**
     * @param database item database, or {@code null}; required for client-id files
     */
    public ItemIdResolver(IdSpace space, ItemDatabase database, UnknownItemPolicy policy,
                          int placeholderId, IssueCollector issues) {
        this.space = Objects.requireNonNull(space, "space");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.issues = Objects.requireNonNull(issues, "issues");
        this.placeholderId = placeholderId;
        this.database = database;
        if (space == IdSpace.CLIENT) {
            this.translator = Objects.requireNonNull(database, "database").translator();
        } else {
            this.translator = null;
        }
    }

    /**
     * Sets the id of {@code item} for the on-disk id {@code rawId}, marking it
     * unresolved where needed.
     *
     * @return the id now held by {@code item}
     * @throws UnmappableIdException when the id is unknown and the policy is {@code FAIL}
     */
    public int apply(Item.Builder item, int rawId, Position at)
    {
        if (space == IdSpace.CLIENT) {
            OptionalInt serverId = translator.findServerId(rawId);
            if (serverId.isPresent()) {
                item.id(serverId.getAsInt());
                return serverId.getAsInt();
            }
            return unresolved(item, rawId, at, IssueCode.UNMAPPED_ITEM_ID,
                    "client id " + rawId + " has no server id", false);
        }

        if (database == null || database.contains(rawId)) {
            item.id(rawId);
            return rawId;
        }
        return unresolved(item, rawId, at, IssueCode.UNKNOWN_ITEM_ID,
                "server id " + rawId + " is not in the item database", policy == UnknownItemPolicy.KEEP);
    }

    private int unresolved(Item.Builder item, int rawId, Position at, IssueCode code, String message, boolean keep)
    {
        if (policy == UnknownItemPolicy.FAIL) {
            throw new UnmappableIdException(message + " at " + at, List.of(new UnmappableItem(at, rawId)));
        }
        if (keep) {
            item.id(rawId);
            issues.report(MapIoIssue.forItem(code, message + "; kept as is", at, rawId));
            return rawId;
        }
        item.id(placeholderId).unresolvedId(new UnresolvedItemId(rawId, space));
        issues.report(MapIoIssue.forItem(code, message + "; replaced by placeholder " + placeholderId, at, rawId));
        return placeholderId;
    }
}
