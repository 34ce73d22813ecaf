package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.storage.otbm.format.ItemDatabaseFiles;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Version hints merged from the workspace context and the project file.
 */
public record WorkspaceHints(OptionalInt clientVersion, ServerEngine engine, ItemDatabaseFiles databaseFiles)
{
    public static final WorkspaceHints NONE = new WorkspaceHints(OptionalInt.empty(), ServerEngine.UNKNOWN, ItemDatabaseFiles.NONE);

    public WorkspaceHints {
        Objects.requireNonNull(clientVersion, "clientVersion");
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(databaseFiles, "databaseFiles");
    }
}
