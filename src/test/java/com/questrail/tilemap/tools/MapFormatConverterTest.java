package com.questrail.tilemap.tools;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.IdSpace;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.api.UnresolvedItemId;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.storage.otbm.codec.PayloadWriter;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.format.OtbmAttribute;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.report.MapIoFailure;
import com.questrail.tilemap.storage.otbm.runtime.OtbmMapStorage;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;
import com.questrail.tilemap.test.ItemsOtbBuilder;
import com.questrail.tilemap.test.OtbmFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MapFormatConverterTest
{
    @TempDir
    Path dir;

    private final OtbmMapStorage storage = OtbmMapStorage.createDefault();
    private final MapFormatConverter converter = new MapFormatConverter(storage);
    private final ItemDatabase db = ItemsOtbBuilder.standardDatabase();

    /**
     * A V3 ServerID map with the standard items.otb beside it.
     */
    private Path serverMap(int extraItemId) throws IOException {
        ItemsOtbBuilder.standard().writeTo(dir.resolve("items.otb"));
        byte[] bytes = OtbmFileBuilder.map(OtbmVersion.V3.wireValue(), 256, 256)
                .mapData("converted")
                .tileArea(0, 0, 7)
                .tileWithGround(1, 1, 100)
                .item(new PayloadWriter().writeU16(2148).writeU8(OtbmAttribute.COUNT.tag()).writeU8(25))
                .item(extraItemId)
                .build();
        return Files.write(dir.resolve("world.otbm"), bytes);
    }

    // ---------------------------------------------------------------------
    // Convert
    // ---------------------------------------------------------------------

    @Test
    void serverIdMapConvertsToClientIds() throws IOException {
        Path source = serverMap(1987);
        Path target = dir.resolve("world-v6.otbm");

        ConversionResult result = converter.convert(source, WorkspaceContext.empty(), target, OtbmVersion.V6);

        assertTrue(result.success(), () -> result.toString());
        LoadResult back = storage.load(target, WorkspaceContext.empty());
        assertEquals(OtbmVersion.V6, back.report().format().orElseThrow().version());

        GameMap converted = back.map().orElseThrow();
        assertEquals("converted", converted.header().descriptionText().orElseThrow());
        Tile tile = converted.tile(Position.of(1, 1, 7)).orElseThrow();
        assertEquals(100, tile.ground().orElseThrow().id());
        assertEquals(2148, tile.items().get(0).id());
        assertEquals(25, tile.items().get(0).count().getAsInt());
    }

    /**
     * The client id file stores the translated ids on disk.
     */
    @Test
    void convertedFileCarriesClientIds() throws IOException {
        Path target = dir.resolve("world-v6.otbm");
        converter.convert(serverMap(1987), WorkspaceContext.empty(), target, OtbmVersion.V6);

        byte[] bytes = Files.readAllBytes(target);
        // Compact ground: ITEM tag, then client id 5000 (0x1388).
        byte[] ground = { 0x09, (byte) 0x88, 0x13 };
        boolean found = false;
        for (int i = 0; i + ground.length <= bytes.length && !found; i++) {
            found = bytes[i] == ground[0] && bytes[i + 1] == ground[1] && bytes[i + 2] == ground[2];
        }
        assertTrue(found);
    }

    @Test
    void itemWithoutClientIdBlocksConversion() throws IOException {
        Path target = dir.resolve("world-v6.otbm");

        ConversionResult result = converter.convert(serverMap(4000), WorkspaceContext.empty(), target, OtbmVersion.V6);

        assertTrue(result.load().success());
        assertFalse(result.success());
        assertInstanceOf(MapIoFailure.UnmappableId.class, result.save().orElseThrow().failure().orElseThrow());
        assertFalse(Files.exists(target));
    }

    @Test
    void failedLoadSkipsTheSave() throws IOException {
        Path source = Files.write(dir.resolve("broken.otbm"), new byte[] { 'O', 'T', 'B', 'M', 0x00 });

        ConversionResult result = converter.convert(source, WorkspaceContext.empty(), dir.resolve("out.otbm"),
                OtbmVersion.V6);

        assertFalse(result.success());
        assertTrue(result.save().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Analyze
    // ---------------------------------------------------------------------

    private static GameMap mixedMap() {
        GameMap map = new GameMap(MapHeader.builder().build());
        map.getOrCreateTile(Position.of(1, 1, 7)).setGround(Item.of(100));
        map.getOrCreateTile(Position.of(2, 1, 7)).addItem(Item.builder(1987)
                .addContent(Item.of(4000))
                .addContent(Item.builder(0).unresolvedId(new UnresolvedItemId(777, IdSpace.SERVER)).build())
                .build());
        return map;
    }

    @Test
    void analysisListsMissingClientIds() {
        ConversionAnalysis a = MapFormatConverter.analyze(mixedMap(), OtbmVersion.V6,
                FormatContext.of(FormatDescriptor.of(OtbmVersion.V4), db));

        assertFalse(a.ok());
        assertEquals(4, a.totalItems());
        assertEquals(1, a.placeholderItems());
        assertEquals(1, a.strandedPlaceholders());
        assertEquals(List.of(4000), a.missingMappings());
    }

    @Test
    void analysisForSameIdSpaceOnlyChecksPlaceholders() {
        ConversionAnalysis a = MapFormatConverter.analyze(mixedMap(), OtbmVersion.V2,
                FormatContext.withoutDatabase(FormatDescriptor.of(OtbmVersion.V4)));

        assertTrue(a.ok());
        assertEquals(0, a.strandedPlaceholders());
        assertTrue(a.missingMappings().isEmpty());
    }

    @Test
    void analysisWithoutDatabaseForClientTarget() {
        ConversionAnalysis a = MapFormatConverter.analyze(mixedMap(), OtbmVersion.V5,
                FormatContext.withoutDatabase(FormatDescriptor.of(OtbmVersion.V4)));
        assertTrue(a.databaseMissing());
        assertFalse(a.ok());
    }
}
