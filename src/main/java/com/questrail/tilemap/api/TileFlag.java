package com.questrail.tilemap.api;

/**
 * Known bits of a tile's flag word.
 *
 * <p>A tile keeps its raw flag word, so bits not listed here survive a
 * load/save cycle unchanged.</p>
 */
public enum TileFlag
{
    PROTECTION_ZONE(0x01),
    NO_PVP(0x04),
    NO_LOGOUT(0x08),
    PVP_ZONE(0x10),
    REFRESH(0x20);

    private final int mask;

    TileFlag(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }
}
