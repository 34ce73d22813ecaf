package com.questrail.tilemap.cli;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.report.LoadReport;
import com.questrail.tilemap.storage.otbm.report.LoadResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command that loads a map and prints its header, format and contents summary.
 */
@Command(
    name = "info",
    description = "Show format, header and statistics of a map"
)
public class InfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Map file (.otbm)")
    private Path mapFile;

    @Mixin
    private WorkspaceOptions workspace;

    @ParentCommand
    private OtbmToolCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        LoadResult result = parent.storage().load(mapFile, workspace.toContext());
        LoadReport report = result.report();
        if (!result.success()) {
            ReportPrinter.printFailure(report.failure().orElseThrow(), err);
            return 1;
        }

        GameMap map = result.map().orElseThrow();
        MapHeader header = map.header();
        FormatDescriptor format = report.format().orElseThrow();

        out.println("File:           " + mapFile);
        out.println("Format:         " + format.version() + " (" + format.version().idSpace() + " ids, "
            + "resolved from " + format.source() + ")");
        out.println("Client version: " + (format.clientVersion() > 0 ? format.clientVersion() : "unknown"));
        out.println("Identifier:     " + header.identifier());
        out.println("Dimensions:     " + header.width() + " x " + header.height());
        out.println("Items version:  " + header.itemsMajorVersion() + "." + header.itemsMinorVersion());
        header.descriptionText().ifPresent(d -> out.println("Description:    " + d));
        out.println("Tile areas:     " + report.statistics().tileAreas());
        out.println("Tiles:          " + map.tileCount());
        out.println("Items:          " + map.itemCount());
        out.println("Towns:          " + map.towns().size());
        out.println("Waypoints:      " + map.waypoints().size());
        out.println("Spawn areas:    " + map.spawnAreas().size());
        out.println("Warnings:       " + report.warnings().size());
        out.println("Errors:         " + report.recoverableErrors().size());
        ReportPrinter.printIssues(report, out);
        return 0;
    }
}
