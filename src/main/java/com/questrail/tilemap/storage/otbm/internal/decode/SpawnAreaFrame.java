package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.SpawnArea;
import com.questrail.tilemap.api.SpawnEntry;
import com.questrail.tilemap.api.SpawnKind;
import com.questrail.tilemap.storage.otbm.format.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * A legacy in-map spawn area. Its creatures arrive as children; the area is
 * added to the map when it closes.
 */
final class SpawnAreaFrame extends DecodeFrame
{
    private final Position center;
    private final int radius;
    private final List<SpawnEntry> entries = new ArrayList<>();

    SpawnAreaFrame(Position center, int radius) {
        super(NodeKind.SPAWN_AREA);
        this.center = center;
        this.radius = radius;
    }

    void add(SpawnEntry entry) {
        entries.add(entry);
    }

    @Override
    public void close(DecodeContext ctx) {
        ctx.map().addSpawnArea(new SpawnArea(SpawnKind.MONSTER, center, radius, entries));
    }
}
