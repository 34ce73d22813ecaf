package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.report.SaveReport;
import com.questrail.tilemap.storage.otbm.runtime.OtbmMapStorage;
import com.questrail.tilemap.tools.ConversionAnalysis;
import com.questrail.tilemap.tools.ConversionResult;
import com.questrail.tilemap.tools.MapFormatConverter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command that rewrites a map in another structural version.
 * <p>
 * Converting between ServerID versions (V1-V4) and ClientID versions (V5-V7)
 * translates every item id through the item database. With {@code --dry-run}
 * nothing is written; the command only reports whether the target can hold
 * every item.
 */
@Command(
    name = "convert",
    description = "Convert a map to another format version"
)
public class ConvertCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Source map file")
    private Path source;

    @Parameters(index = "1", arity = "0..1", description = "Destination map file (not needed with --dry-run)")
    private Path destination;

    @Option(
        names = {"--to"},
        required = true,
        description = "Target version: ${COMPLETION-CANDIDATES}"
    )
    private OtbmVersion target;

    @Option(
        names = {"--dry-run"},
        description = "Only check whether the conversion would succeed"
    )
    private boolean dryRun;

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
        OtbmMapStorage storage = parent.storage();

        if (dryRun) {
            LoadResult loaded = storage.load(source, workspace.toContext());
            if (!loaded.success()) {
                ReportPrinter.printFailure(loaded.report().failure().orElseThrow(), err);
                return 1;
            }
            FormatContext context = loaded.context().orElseThrow();
            ConversionAnalysis analysis = MapFormatConverter.analyze(loaded.map().orElseThrow(), target, context);
            out.println("Conversion " + context.version() + " -> " + target + ": "
                + (analysis.ok() ? "possible" : "NOT possible"));
            out.println("  items:                " + analysis.totalItems());
            out.println("  placeholder items:    " + analysis.placeholderItems());
            if (analysis.databaseMissing()) {
                out.println("  no item database available for client ids");
            }
            if (!analysis.missingMappings().isEmpty()) {
                out.println("  ids without client id: " + analysis.missingMappings());
            }
            return analysis.ok() ? 0 : 1;
        }

        if (destination == null) {
            err.println("Error: a destination file is required unless --dry-run is given.");
            return 2;
        }

        ConversionResult result = new MapFormatConverter(storage).convert(source, workspace.toContext(), destination, target);
        ReportPrinter.printIssues(result.load(), out);
        if (!result.load().success()) {
            ReportPrinter.printFailure(result.load().failure().orElseThrow(), err);
            return 1;
        }
        SaveReport saved = result.save().orElseThrow();
        ReportPrinter.printIssues(saved, out);
        if (!saved.success()) {
            ReportPrinter.printFailure(saved.failure().orElseThrow(), err);
            return 1;
        }
        out.println("Wrote " + destination + " as " + target + " (" + saved.statistics().bytesWritten() + " bytes, "
            + saved.statistics().tiles() + " tiles)");
        return 0;
    }
}
