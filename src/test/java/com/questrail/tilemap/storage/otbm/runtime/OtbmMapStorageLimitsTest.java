package com.questrail.tilemap.storage.otbm.runtime;

import com.questrail.tilemap.storage.otbm.config.MapIoConfig;
import com.questrail.tilemap.storage.otbm.config.ResourceLimits;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.observability.LoadCompletedEvent;
import com.questrail.tilemap.storage.otbm.observability.MapIoErrorEvent;
import com.questrail.tilemap.storage.otbm.observability.RecordingMapIoObservabilitySink;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.report.LoadStatistics;
import com.questrail.tilemap.storage.otbm.report.MapIoFailure;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;
import com.questrail.tilemap.test.OtbmFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resource limits, cancellation and the memory bound of streaming loads.
 */
final class OtbmMapStorageLimitsTest
{
    @TempDir
    Path dir;

    private static OtbmMapStorage storageWith(ResourceLimits limits) {
        return OtbmMapStorage.builder()
                .withConfig(MapIoConfig.builder().withLimits(limits).build())
                .build();
    }

    /**
     * {@code areas} tile areas on floor 7, each holding {@code tilesPerArea}
     * tiles with a compact ground.
     */
    private static byte[] gridMap(int areas, int tilesPerArea)
    {
        OtbmFileBuilder b = OtbmFileBuilder.map(2, 0xFFFF, 0xFFFF).mapData();
        for (int a = 0; a < areas; a++) {
            b.tileArea((a % 64) * 256, (a / 64) * 256, 7);
            for (int t = 0; t < tilesPerArea; t++) {
                b.tileWithGround(t % 256, t / 256, 100).close();
            }
            b.close();
        }
        return b.build();
    }

    private Path write(String name, byte[] bytes) throws IOException {
        return Files.write(dir.resolve(name), bytes);
    }

    // ---------------------------------------------------------------------
    // Counted resources
    // ---------------------------------------------------------------------

    @Test
    void tileCountBeyondHardLimitFailsTheLoad() throws IOException {
        LoadResult result = storageWith(ResourceLimits.builder().withTiles(2, 3).build())
                .load(write("tiles.otbm", gridMap(1, 4)), WorkspaceContext.empty());

        assertFalse(result.success());
        assertTrue(result.map().isEmpty());
        MapIoFailure.ResourceLimitExceeded failure = assertInstanceOf(MapIoFailure.ResourceLimitExceeded.class,
                result.report().failure().orElseThrow());
        assertEquals("tile count", failure.limit());
        assertEquals(3, failure.threshold());
        assertEquals(4, failure.observed());
    }

    @Test
    void tileCountAboveWarningThresholdIsReportedOnce() throws IOException {
        LoadResult result = storageWith(ResourceLimits.builder().withTiles(2, 10).build())
                .load(write("tiles.otbm", gridMap(1, 6)), WorkspaceContext.empty());

        assertTrue(result.success());
        assertEquals(6, result.map().orElseThrow().tileCount());
        assertEquals(1, result.report().warnings().stream()
                .filter(i -> i.code() == IssueCode.RESOURCE_THRESHOLD).count());
    }

    @Test
    void itemCountBeyondHardLimitFailsTheLoad() throws IOException {
        byte[] bytes = OtbmFileBuilder.map(2, 256, 256)
                .mapData()
                .tileArea(0, 0, 7)
                .tile(0, 0).item(1987).item(1987).item(1987)
                .build();
        LoadResult result = storageWith(ResourceLimits.builder().withItems(1, 2).build())
                .load(write("items.otbm", bytes), WorkspaceContext.empty());

        MapIoFailure.ResourceLimitExceeded failure =
                (MapIoFailure.ResourceLimitExceeded) result.report().failure().orElseThrow();
        assertEquals("item count", failure.limit());
    }

    @Test
    void fileLargerThanLimitIsRejectedBeforeParsing() throws IOException {
        Path file = write("big.otbm", OtbmFileBuilder.singleGroundTile());
        LoadResult result = storageWith(ResourceLimits.builder().withFileBytes(10, 20).build())
                .load(file, WorkspaceContext.empty());

        MapIoFailure.ResourceLimitExceeded failure =
                (MapIoFailure.ResourceLimitExceeded) result.report().failure().orElseThrow();
        assertEquals("file size", failure.limit());
        assertEquals(0, result.report().statistics().bytesRead());
    }

    @Test
    void fileAboveWarningSizeLoadsWithWarning() throws IOException {
        Path file = write("big.otbm", OtbmFileBuilder.singleGroundTile());
        LoadResult result = storageWith(ResourceLimits.builder().withFileBytes(10, 1_000_000).build())
                .load(file, WorkspaceContext.empty());

        assertTrue(result.success());
        assertTrue(result.report().hasIssue(IssueCode.RESOURCE_THRESHOLD));
    }

    @Test
    void oversizedNodePayloadFailsTheLoad() throws IOException {
        byte[] bytes = OtbmFileBuilder.map(2, 256, 256).mapData("d".repeat(200)).build();
        LoadResult result = storageWith(ResourceLimits.builder().withMaxPayloadBytes(64).build())
                .load(write("payload.otbm", bytes), WorkspaceContext.empty());

        MapIoFailure.ResourceLimitExceeded failure =
                (MapIoFailure.ResourceLimitExceeded) result.report().failure().orElseThrow();
        assertEquals("node payload bytes", failure.limit());
    }

    @Test
    void nestingBeyondLimitFailsTheLoad() throws IOException {
        OtbmFileBuilder b = OtbmFileBuilder.map(2, 256, 256).mapData().tileArea(0, 0, 7).tile(0, 0);
        for (int i = 0; i < 6; i++) {
            b.open(NodeKind.ITEM.type(), new byte[] { (byte) 0xC3, 0x07 });
        }
        LoadResult result = storageWith(ResourceLimits.builder().withMaxNodeDepth(8).build())
                .load(write("deep.otbm", b.build()), WorkspaceContext.empty());

        MapIoFailure.ResourceLimitExceeded failure =
                (MapIoFailure.ResourceLimitExceeded) result.report().failure().orElseThrow();
        assertEquals("node nesting depth", failure.limit());
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    @Test
    void cancelledLoadReturnsNoMap() throws IOException {
        CancellationSource cancellation = new CancellationSource();
        cancellation.cancel();
        RecordingMapIoObservabilitySink sink = new RecordingMapIoObservabilitySink();
        OtbmMapStorage storage = OtbmMapStorage.builder().withObservabilitySink(sink).build();

        LoadResult result = storage.load(write("grid.otbm", gridMap(3, 10)), WorkspaceContext.empty(), cancellation);

        assertFalse(result.success());
        assertTrue(result.map().isEmpty());
        assertInstanceOf(MapIoFailure.Cancelled.class, result.report().failure().orElseThrow());
        assertTrue(sink.hasEventOfType(MapIoErrorEvent.class));
        assertTrue(sink.hasEventOfType(LoadCompletedEvent.class));
    }

    /**
     * Cancellation requested part way through stops the load at the next
     * tile area.
     */
    @Test
    void cancellationIsObservedBetweenTileAreas() throws IOException {
        AtomicInteger polls = new AtomicInteger();
        CancellationToken afterTwoAreas = () -> polls.incrementAndGet() > 2;

        LoadResult result = OtbmMapStorage.createDefault()
                .load(write("grid.otbm", gridMap(5, 10)), WorkspaceContext.empty(), afterTwoAreas);

        assertInstanceOf(MapIoFailure.Cancelled.class, result.report().failure().orElseThrow());
        assertEquals(2, result.report().statistics().tileAreas());
        assertEquals(20, result.report().statistics().tiles());
    }

    @Test
    void streamLoadHonoursCancellation() {
        CancellationSource cancellation = new CancellationSource();
        cancellation.cancel();
        LoadResult result = OtbmMapStorage.createDefault().load(new ByteArrayInputStream(gridMap(1, 1)),
                WorkspaceContext.empty(), cancellation);
        assertInstanceOf(MapIoFailure.Cancelled.class, result.report().failure().orElseThrow());
    }

    // ---------------------------------------------------------------------
    // Streaming
    // ---------------------------------------------------------------------

    /**
     * Two files with the same number of tiles, one spread over many areas and
     * one packed into few, need the same working memory: the reader never
     * holds more than one node payload and one frame per open level.
     */
    @Test
    void workingMemoryDoesNotGrowWithAreaSize() throws IOException {
        OtbmMapStorage storage = OtbmMapStorage.createDefault();
        LoadResult spread = storage.load(write("spread.otbm", gridMap(100, 1_000)), WorkspaceContext.empty());
        LoadResult packed = storage.load(write("packed.otbm", gridMap(2, 50_000)), WorkspaceContext.empty());

        assertTrue(spread.success());
        assertTrue(packed.success());
        LoadStatistics a = spread.report().statistics();
        LoadStatistics b = packed.report().statistics();
        assertEquals(100_000, a.tiles());
        assertEquals(100_000, b.tiles());
        assertEquals(a.largestPayload(), b.largestPayload());
        assertEquals(a.deepestNesting(), b.deepestNesting());
        assertEquals(4, b.deepestNesting());
        assertEquals(16, b.largestPayload());
    }
}
