package com.questrail.tilemap.api;

import java.util.Comparator;

/**
 * Position
 * -----------------------------------------------------------------------------
 * An absolute map coordinate.
 *
 * <p>{@code x} and {@code y} are unsigned 16-bit values and {@code z} (the floor)
 * is an unsigned 8-bit value, matching what the map file can represent. Values
 * outside those ranges are rejected at construction so that a position held in
 * memory is always writable.</p>
 *
 * <p>The natural order is (z, y, x), which is the order tiles are emitted in
 * when a map is saved.</p>
 */
public record Position(int x, int y, int z) implements Comparable<Position>
{
    public static final int MAX_XY = 0xFFFF;
    public static final int MAX_Z = 0xFF;

    private static final Comparator<Position> ORDER =
            Comparator.comparingInt(Position::z)
                    .thenComparingInt(Position::y)
                    .thenComparingInt(Position::x);

    public Position {
        if (x < 0 || x > MAX_XY) {
            throw new IllegalArgumentException("x out of range: " + x);
        }
        if (y < 0 || y > MAX_XY) {
            throw new IllegalArgumentException("y out of range: " + y);
        }
        if (z < 0 || z > MAX_Z) {
            throw new IllegalArgumentException("z out of range: " + z);
        }
    }

    public static Position of(int x, int y, int z) {
        return new Position(x, y, z);
    }

    @Override
    public int compareTo(Position other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
