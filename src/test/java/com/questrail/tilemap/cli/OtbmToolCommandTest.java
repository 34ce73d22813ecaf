package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.test.ItemsOtbBuilder;
import com.questrail.tilemap.test.OtbmFileBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class OtbmToolCommandTest
{
    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path map;

    @BeforeEach
    void writeMap() throws IOException {
        map = Files.write(dir.resolve("world.otbm"), OtbmFileBuilder.singleGroundTile());
    }

    private int run(String... args) {
        CommandLine cl = OtbmToolCommand.createCommandLine();
        cl.setOut(new PrintWriter(out, true));
        cl.setErr(new PrintWriter(err, true));
        return cl.execute(args);
    }

    // ---------------------------------------------------------------------
    // info / validate
    // ---------------------------------------------------------------------

    @Test
    void infoPrintsFormatAndCounts() {
        assertEquals(0, run("info", map.toString()));
        String text = out.toString();
        assertTrue(text.contains("Format:         V3"), text);
        assertTrue(text.contains("Dimensions:     256 x 256"), text);
        assertTrue(text.contains("Tiles:          1"), text);
    }

    @Test
    void infoOnCorruptFileFails() throws IOException {
        Path broken = Files.write(dir.resolve("broken.otbm"), new byte[] { 'O', 'T', 'B', 'M', (byte) 0xFE, 0x00 });
        assertEquals(1, run("info", broken.toString()));
        assertTrue(err.toString().startsWith("Error:"), err.toString());
    }

    @Test
    void validateCleanMapSucceeds() {
        assertEquals(0, run("validate", map.toString()));
        assertTrue(out.toString().contains("0 error(s), 0 warning(s)"));
    }

    @Test
    void validateReportsTilesOutsideTheMap() throws IOException {
        Path small = Files.write(dir.resolve("small.otbm"), OtbmFileBuilder.map(2, 10, 10)
                .mapData()
                .tileArea(0, 0, 7)
                .tileWithGround(50, 50, 100)
                .build());

        assertEquals(1, run("validate", small.toString()));
        assertTrue(out.toString().contains("TILE_OUT_OF_BOUNDS"));
    }

    // ---------------------------------------------------------------------
    // convert
    // ---------------------------------------------------------------------

    @Test
    void convertWritesTheTargetVersion() throws IOException {
        Path otb = ItemsOtbBuilder.standard().writeTo(dir.resolve("items.otb"));
        Path target = dir.resolve("world-v6.otbm");

        int code = run("convert", map.toString(), target.toString(), "--to", "v6", "--items-otb", otb.toString());

        assertEquals(0, code, err.toString());
        assertTrue(Files.exists(target));
        assertTrue(out.toString().contains("as V6"));
        // Root payload starts with the structural version, little endian.
        byte[] bytes = Files.readAllBytes(target);
        assertEquals(OtbmVersion.V6.wireValue(), bytes[6]);
    }

    @Test
    void dryRunWithoutDatabaseIsNotPossible() {
        assertEquals(1, run("convert", map.toString(), "--to", "V5", "--dry-run", "--no-project"));
        assertTrue(out.toString().contains("NOT possible"));
        assertTrue(out.toString().contains("no item database"));
    }

    @Test
    void dryRunToServerIdVersionIsPossible() {
        assertEquals(0, run("convert", map.toString(), "--to", "V4", "--dry-run"));
        assertTrue(out.toString().contains("V3 -> V4: possible"));
    }

    @Test
    void convertWithoutDestinationIsAUsageError() {
        assertEquals(2, run("convert", map.toString(), "--to", "V4"));
        assertTrue(err.toString().contains("destination"));
    }

    @Test
    void unknownTargetVersionIsRejectedByTheParser() {
        assertNotEquals(0, run("convert", map.toString(), "--to", "V9", "--dry-run"));
    }
}
