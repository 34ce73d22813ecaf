package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.storage.otbm.format.NodeKind;

/**
 * A tile area: the base coordinates its tiles are offset from.
 */
final class TileAreaFrame extends DecodeFrame
{
    private final int baseX;
    private final int baseY;
    private final int z;

    TileAreaFrame(int baseX, int baseY, int z) {
        super(NodeKind.TILE_AREA);
        this.baseX = baseX;
        this.baseY = baseY;
        this.z = z;
    }

    int baseX() {
        return baseX;
    }

    int baseY() {
        return baseY;
    }

    int z() {
        return z;
    }
}
