package com.questrail.tilemap.storage.otbm.version;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Map metadata declared by a project file next to the map.
 *
 * <p>Relative paths are already resolved against the directory of
 * {@code source}.</p>
 */
public record ProjectMetadata(
        Path source,
        String projectName,
        ServerEngine engine,
        OptionalInt clientVersion,
        Optional<Path> mapFile,
        Optional<Path> itemsOtb,
        Optional<Path> itemsXml
) {
    public ProjectMetadata {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(clientVersion, "clientVersion");
        Objects.requireNonNull(mapFile, "mapFile");
        Objects.requireNonNull(itemsOtb, "itemsOtb");
        Objects.requireNonNull(itemsXml, "itemsXml");
    }
}
