package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.OpaqueNode;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.storage.otbm.codec.PayloadWriter;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.runtime.OtbmMapStorage;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;
import com.questrail.tilemap.test.OtbmFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class NodeDecoderTableTest
{
    @TempDir
    Path dir;

    private static byte[] mapWithTown() {
        return OtbmFileBuilder.map(2, 256, 256)
                .mapData()
                .tileArea(0, 0, 7)
                .tileWithGround(1, 1, 100)
                .close()
                .close()
                .open(NodeKind.TOWNS, new PayloadWriter())
                .leaf(NodeKind.TOWN, new PayloadWriter().writeU32(3).writeString("Venore").writePosition(Position.of(1, 1, 7)))
                .build();
    }

    /**
     * The standard table without the town placement.
     */
    private static NodeDecoderTable withoutTowns() {
        return NodeDecoderTable.builder()
                .register(NodeKind.ROOT, NodeKind.MAP_DATA, StandardDecoders::mapData)
                .register(NodeKind.MAP_DATA, NodeKind.TILE_AREA, StandardDecoders::tileArea)
                .register(NodeKind.TILE_AREA, NodeKind.TILE, StandardDecoders::tile)
                .register(NodeKind.TILE, NodeKind.ITEM, StandardDecoders::item)
                .build();
    }

    @Test
    void standardTableKnowsEveryPlacement() {
        NodeDecoderTable table = NodeDecoderTable.standard();
        assertTrue(table.find(NodeKind.TILE_AREA, NodeKind.TILE).isPresent());
        assertTrue(table.find(NodeKind.TILE_AREA, NodeKind.HOUSETILE).isPresent());
        assertTrue(table.find(NodeKind.ITEM, NodeKind.ITEM).isPresent());
        assertTrue(table.find(NodeKind.SPAWN_AREA, NodeKind.MONSTER).isPresent());
        assertFalse(table.find(NodeKind.TILE_AREA, NodeKind.ITEM).isPresent());
        assertFalse(table.find(NodeKind.TOWNS, NodeKind.WAYPOINT).isPresent());
    }

    @Test
    void builtTableIsIndependentOfItsBuilder() {
        NodeDecoderTable.Builder builder = NodeDecoderTable.builder()
                .register(NodeKind.ROOT, NodeKind.MAP_DATA, StandardDecoders::mapData);
        NodeDecoderTable table = builder.build();
        builder.register(NodeKind.MAP_DATA, NodeKind.TOWNS, StandardDecoders::towns);
        assertTrue(table.find(NodeKind.MAP_DATA, NodeKind.TOWNS).isEmpty());
    }

    /**
     * A placement missing from the table is preserved under map data and
     * written back unchanged.
     */
    @Test
    void unregisteredChildOfMapDataIsKeptOpaque() throws IOException
    {
        Path source = Files.write(dir.resolve("towns.otbm"), mapWithTown());
        OtbmMapStorage narrow = OtbmMapStorage.builder().withDecoderTable(withoutTowns()).build();

        LoadResult loaded = narrow.load(source, WorkspaceContext.empty());

        assertTrue(loaded.success());
        assertTrue(loaded.report().hasIssue(IssueCode.UNKNOWN_NODE));
        GameMap map = loaded.map().orElseThrow();
        assertTrue(map.towns().isEmpty());
        assertEquals(1, map.opaqueNodes().size());
        OpaqueNode towns = map.opaqueNodes().get(0);
        assertEquals(NodeKind.TOWNS.type(), towns.type());
        assertEquals(1, towns.children().size());

        Path copy = dir.resolve("copy.otbm");
        assertTrue(narrow.save(map, copy, FormatContext.withoutDatabase(FormatDescriptor.of(OtbmVersion.V3))).success());
        assertArrayEquals(Files.readAllBytes(source), Files.readAllBytes(copy));

        GameMap full = OtbmMapStorage.createDefault().load(copy, WorkspaceContext.empty()).map().orElseThrow();
        assertEquals("Venore", full.town(3).orElseThrow().name());
    }
}
