package com.questrail.tilemap.api;

import java.util.Objects;

/**
 * A named map position used by scripts.
 */
public record Waypoint(String name, Position position)
{
    public Waypoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }
}
