package com.questrail.tilemap.storage.otbm.version;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * ProjectMetadataReader
 * -----------------------------------------------------------------------------
 * Finds and parses the project file that describes a map.
 *
 * <p>Lookup order for a map {@code foo.otbm}: the sidecar {@code foo.json},
 * then {@code map_project.json} in the same directory.</p>
 *
 * <p>Two layouts are accepted: a flat one
 * ({@code {engine, client_version, map_file, definitions}}) and one where
 * {@code engine}, {@code client_version} and {@code map_file} sit under a
 * nested {@code metadata} object. Flat values are used when the nested ones
 * are absent.</p>
 */
public final class ProjectMetadataReader
{
    public static final String PROJECT_FILE_NAME = "map_project.json";

    private final Gson gson = new GsonBuilder().create();

    /**
     * Locates the project file for a map, without reading it.
     */
    public Optional<Path> locate(Path mapFile)
    {
        String name = mapFile.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return Files.isRegularFile(mapFile) ? Optional.of(mapFile) : Optional.empty();
        }
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path sidecar = mapFile.resolveSibling(stem + ".json");
        if (Files.isRegularFile(sidecar)) {
            return Optional.of(sidecar);
        }
        Path project = mapFile.resolveSibling(PROJECT_FILE_NAME);
        return Files.isRegularFile(project) ? Optional.of(project) : Optional.empty();
    }

    public ProjectMetadata read(Path projectFile) throws ProjectMetadataException
    {
        ProjectFile raw;
        try (Reader reader = Files.newBufferedReader(projectFile, StandardCharsets.UTF_8)) {
            raw = gson.fromJson(reader, ProjectFile.class);
        }
        catch (IOException | JsonParseException e) {
            throw new ProjectMetadataException("cannot read project file " + projectFile + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ProjectMetadataException("project file " + projectFile + " is empty");
        }

        Path base = projectFile.toAbsolutePath().getParent();
        Metadata nested = raw.metadata;

        String engine = nested != null && nested.engine != null ? nested.engine : raw.engine;
        String clientVersion = nested != null && nested.clientVersion != null ? nested.clientVersion : raw.clientVersion;
        String mapFile = raw.mapFile != null ? raw.mapFile : (nested != null ? nested.mapFile : null);
        Definitions defs = raw.definitions != null ? raw.definitions : new Definitions();

        return new ProjectMetadata(
                projectFile,
                raw.projectName == null ? "" : raw.projectName,
                ServerEngine.normalize(engine),
                parseClientVersion(clientVersion, projectFile),
                resolve(base, mapFile),
                resolve(base, defs.itemsOtb),
                resolve(base, defs.itemsXml));
    }

    /**
     * Accepts a plain number ({@code 1310}) or a dotted client version
     * ({@code "13.10"}, {@code "8.6"}), which becomes {@code major * 100 + minor}
     * with the minor part read as two digits.
     */
    static OptionalInt parseClientVersion(String value, Path source) throws ProjectMetadataException
    {
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        String v = value.trim();
        try {
            int version;
            int dot = v.indexOf('.');
            if (dot < 0) {
                version = Integer.parseInt(v);
            } else {
                String minor = (v.substring(dot + 1) + "00").substring(0, 2);
                version = Integer.parseInt(v.substring(0, dot)) * 100 + Integer.parseInt(minor);
            }
            return version > 0 ? OptionalInt.of(version) : OptionalInt.empty();
        }
        catch (NumberFormatException e) {
            throw new ProjectMetadataException("invalid client_version '" + value + "' in " + source, e);
        }
    }

    private static Optional<Path> resolve(Path base, String value)
    {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path p = Path.of(value);
        return Optional.of(p.isAbsolute() || base == null ? p : base.resolve(p).normalize());
    }

    // Gson binding types.

    static final class ProjectFile {
        @SerializedName("project_name")
        String projectName;
        String engine;
        @SerializedName("client_version")
        String clientVersion;
        @SerializedName("map_file")
        String mapFile;
        Metadata metadata;
        Definitions definitions;
    }

    static final class Metadata {
        String engine;
        @SerializedName("client_version")
        String clientVersion;
        @SerializedName("map_file")
        String mapFile;
    }

    static final class Definitions {
        @SerializedName("items_otb")
        String itemsOtb;
        @SerializedName("items_xml")
        String itemsXml;
    }
}
