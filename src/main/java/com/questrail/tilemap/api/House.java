package com.questrail.tilemap.api;

import java.util.Objects;
import java.util.Optional;

/**
 * A house definition.
 *
 * <p>Houses are supplied by the host from side-channel data; the map file only
 * stores house ids on tiles. Which tiles belong to a house is tracked by
 * {@link GameMap#houseTiles(int)}.</p>
 *
 * @param entry the door-side entry position, or {@code null} when unknown
 */
public record House(int id, String name, int townId, int rent, Position entry, boolean guildhall)
{
    public House {
        if (id <= 0) {
            throw new IllegalArgumentException("house id must be positive: " + id);
        }
        Objects.requireNonNull(name, "name");
    }

    public Optional<Position> entryPosition() {
        return Optional.ofNullable(entry);
    }
}
