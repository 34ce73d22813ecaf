package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.storage.otbm.config.ResourceLimits;
import com.questrail.tilemap.storage.otbm.error.ResourceLimitExceededException;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.Objects;

/**
 * ResourceGuard
 * -----------------------------------------------------------------------------
 * Counts decoded entities against {@link ResourceLimits}.
 *
 * <p>Crossing a warning threshold reports one {@link IssueCode#RESOURCE_THRESHOLD}
 * warning per resource. Crossing a hard threshold throws
 * {@link ResourceLimitExceededException} at the entity that crossed it, before
 * it is added to the map.</p>
 */
public final class ResourceGuard
{
    private final ResourceLimits limits;
    private final IssueCollector issues;

    private int tileAreas;
    private long tiles;
    private long items;
    private boolean tilesWarned;
    private boolean itemsWarned;

    public ResourceGuard(ResourceLimits limits, IssueCollector issues) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.issues = Objects.requireNonNull(issues, "issues");
    }

    /**
     * Checks the size of the whole input before parsing starts.
     */
    public void checkFileSize(long bytes)
    {
        if (bytes > limits.maxFileBytes()) {
            throw new ResourceLimitExceededException("file size", limits.maxFileBytes(), bytes);
        }
        if (bytes > limits.warnFileBytes()) {
            issues.report(MapIoIssue.of(IssueCode.RESOURCE_THRESHOLD,
                    "file size " + bytes + " bytes is above the warning threshold of " + limits.warnFileBytes()));
        }
    }

    public void countTileArea() {
        tileAreas++;
    }

    public void countTile()
    {
        tiles++;
        if (tiles > limits.maxTiles()) {
            throw new ResourceLimitExceededException("tile count", limits.maxTiles(), tiles);
        }
        if (!tilesWarned && tiles > limits.warnTiles()) {
            tilesWarned = true;
            issues.report(MapIoIssue.of(IssueCode.RESOURCE_THRESHOLD,
                    "more than " + limits.warnTiles() + " tiles"));
        }
    }

    public void countItem()
    {
        items++;
        if (items > limits.maxItems()) {
            throw new ResourceLimitExceededException("item count", limits.maxItems(), items);
        }
        if (!itemsWarned && items > limits.warnItems()) {
            itemsWarned = true;
            issues.report(MapIoIssue.of(IssueCode.RESOURCE_THRESHOLD,
                    "more than " + limits.warnItems() + " items"));
        }
    }

    public int tileAreas() {
        return tileAreas;
    }

    public long tiles() {
        return tiles;
    }

    public long items() {
        return items;
    }
}
