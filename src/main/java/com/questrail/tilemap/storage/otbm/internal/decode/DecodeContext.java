package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.error.StructuralCorruptionException;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Shared state of one load, passed to every {@link NodeDecoder}.
 *
 * <p>The context owns nothing beyond the call: a new one is built per load.</p>
 */
public final class DecodeContext
{
    private final GameMap map;
    private final OtbmVersion version;
    private final ItemDatabase database;
    private final ItemIdResolver ids;
    private final IssueCollector issues;
    private final ResourceGuard guard;
    private final Supplier<String> nodePath;

    /**
     * @param database item database, or {@code null} when none is available
     * @param nodePath path of the node being read, for error messages
     */
    public DecodeContext(GameMap map, OtbmVersion version, ItemDatabase database, ItemIdResolver ids,
                         IssueCollector issues, ResourceGuard guard, Supplier<String> nodePath) {
        this.map = Objects.requireNonNull(map, "map");
        this.version = Objects.requireNonNull(version, "version");
        this.database = database;
        this.ids = Objects.requireNonNull(ids, "ids");
        this.issues = Objects.requireNonNull(issues, "issues");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.nodePath = Objects.requireNonNull(nodePath, "nodePath");
    }

    public GameMap map() {
        return map;
    }

    public OtbmVersion version() {
        return version;
    }

    public IssueCollector issues() {
        return issues;
    }

    public ResourceGuard guard() {
        return guard;
    }

    public void report(MapIoIssue issue) {
        issues.report(issue);
    }

    public int resolveItemId(Item.Builder item, int rawId, Position at) {
        return ids.apply(item, rawId, at);
    }

    /**
     * True when the database classifies {@code serverId} as ground. Without a
     * database nothing is ground.
     */
    public boolean isGround(int serverId) {
        return database != null && database.isGround(serverId);
    }

    public boolean hasInlineSubtype(int serverId) {
        return version.hasInlineSubtype() && database != null && database.hasInlineSubtype(serverId);
    }

    public String nodePath() {
        return nodePath.get();
    }

    public StructuralCorruptionException corruption(String message, NodeEvent.Start node) {
        return new StructuralCorruptionException(message, node.offset(), nodePath());
    }
}
