package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.tools.MapValidator;
import com.questrail.tilemap.tools.ValidationIssue;
import com.questrail.tilemap.tools.ValidationResult;

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
 * CLI command that loads a map and checks it for dangling references and
 * out-of-bounds positions.
 * <p>
 * Exit code 0 means no errors were found (and no warnings with {@code --strict}).
 */
@Command(
    name = "validate",
    description = "Check a map for dangling references and misplaced entities"
)
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Map file (.otbm)")
    private Path mapFile;

    @Option(
        names = {"--strict"},
        description = "Fail on warnings as well as errors"
    )
    private boolean strict;

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
        if (!result.success()) {
            ReportPrinter.printFailure(result.report().failure().orElseThrow(), err);
            return 1;
        }
        ReportPrinter.printIssues(result.report(), out);

        ValidationResult validation = new MapValidator().validate(result.map().orElseThrow());
        for (ValidationIssue issue : validation.issues()) {
            out.println(issue);
        }
        out.println(validation.errors().size() + " error(s), " + validation.warnings().size() + " warning(s)");

        boolean failed = validation.hasErrors() || (strict && !validation.warnings().isEmpty());
        return failed ? 1 : 0;
    }
}
