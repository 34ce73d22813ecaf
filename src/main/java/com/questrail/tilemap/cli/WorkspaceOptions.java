package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.format.ItemDatabaseFiles;
import com.questrail.tilemap.storage.otbm.version.ServerEngine;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;

import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Options shared by every subcommand that reads a map.
 */
public class WorkspaceOptions {

    @Option(
        names = {"--items-otb"},
        description = "Item database (items.otb); default: project file or conventional locations"
    )
    Path itemsOtb;

    @Option(
        names = {"--items-xml"},
        description = "Item names (items.xml)"
    )
    Path itemsXml;

    @Option(
        names = {"--client-version"},
        description = "Client version hint, e.g. 1310 for 13.10"
    )
    Integer clientVersion;

    @Option(
        names = {"--engine"},
        description = "Server engine hint: canary or tfs"
    )
    String engine;

    @Option(
        names = {"--workspace"},
        description = "Workspace root searched for item database files"
    )
    Path workspaceRoot;

    @Option(
        names = {"--no-project"},
        description = "Ignore project metadata files next to the map"
    )
    boolean noProject;

    WorkspaceContext toContext() {
        WorkspaceContext.Builder b = WorkspaceContext.builder()
            .withEngineHint(ServerEngine.normalize(engine))
            .withProjectMetadata(!noProject);
        if (clientVersion != null) {
            b.withClientVersionHint(clientVersion);
        }
        if (workspaceRoot != null) {
            b.withWorkspaceRoot(workspaceRoot);
        }
        if (itemsOtb != null || itemsXml != null) {
            b.withDatabaseFiles(new ItemDatabaseFiles(Optional.ofNullable(itemsOtb), Optional.ofNullable(itemsXml)));
        }
        return b.build();
    }
}
