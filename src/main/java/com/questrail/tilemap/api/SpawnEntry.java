package com.questrail.tilemap.api;

import java.util.Objects;

/**
 * One creature of a spawn area, placed relative to the area's center.
 */
public record SpawnEntry(String creatureName, int offsetX, int offsetY, int intervalSeconds)
{
    public SpawnEntry {
        Objects.requireNonNull(creatureName, "creatureName");
        if (intervalSeconds < 0) {
            throw new IllegalArgumentException("intervalSeconds must not be negative");
        }
    }
}
