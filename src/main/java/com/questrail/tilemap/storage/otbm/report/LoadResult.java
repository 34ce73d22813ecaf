package com.questrail.tilemap.storage.otbm.report;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.storage.otbm.format.FormatContext;

import java.util.Objects;
import java.util.Optional;

/**
 * A loaded map (absent on failure), the format context it was read with, and
 * the load report.
 *
 * <p>The context is what a later save of the same map into the same format
 * should be given.</p>
 */
public record LoadResult(Optional<GameMap> map, Optional<FormatContext> context, LoadReport report)
{
    public LoadResult {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(report, "report");
        if (report.success() != map.isPresent()) {
            throw new IllegalArgumentException("a map is present exactly when the load succeeded");
        }
    }

    public static LoadResult failed(LoadReport report) {
        return new LoadResult(Optional.empty(), Optional.empty(), report);
    }

    public boolean success() {
        return report.success();
    }
}
