package com.questrail.tilemap.api;

import java.util.Objects;

/**
 * A town with its temple (respawn) position.
 */
public record Town(int id, String name, Position templePosition)
{
    public Town {
        if (id < 0) {
            throw new IllegalArgumentException("town id must not be negative: " + id);
        }
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(templePosition, "templePosition");
    }
}
