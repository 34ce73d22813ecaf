package com.questrail.tilemap.api;

import java.util.List;
import java.util.Objects;

/**
 * A circular spawn region and the creatures it spawns.
 */
public record SpawnArea(SpawnKind kind, Position center, int radius, List<SpawnEntry> entries)
{
    public SpawnArea {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(center, "center");
        entries = List.copyOf(entries);
    }
}
