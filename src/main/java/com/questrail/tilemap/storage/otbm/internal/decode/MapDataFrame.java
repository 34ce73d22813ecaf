package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.OpaqueNode;
import com.questrail.tilemap.storage.otbm.format.NodeKind;

import java.util.Objects;

final class MapDataFrame extends DecodeFrame
{
    private final GameMap map;

    MapDataFrame(GameMap map) {
        super(NodeKind.MAP_DATA);
        this.map = Objects.requireNonNull(map, "map");
    }

    @Override
    public boolean keepsOpaqueChildren() {
        return true;
    }

    @Override
    public void acceptOpaque(OpaqueNode node) {
        map.addOpaqueNode(node);
    }
}
