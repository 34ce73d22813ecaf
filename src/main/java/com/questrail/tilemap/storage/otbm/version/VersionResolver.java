package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.api.IdSpace;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.storage.otbm.error.VersionUnsupportedException;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.format.ItemDatabaseFiles;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.format.ResolutionSource;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * VersionResolver
 * =============================================================================
 * Decides the format of a map from everything known about it.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>explicit workspace hints and the project file (client version, engine)</li>
 *   <li>the version field of the map header</li>
 *   <li>the client version of the item database</li>
 *   <li>a generic fallback</li>
 * </ol>
 *
 * <p>When reading, the header is the bytes actually on disk, so it always
 * decides the structural version and id space; hints only supply the client
 * version and item database files, and a hint that contradicts the header is
 * reported. When choosing a save target for a map without a file, hints come
 * first.</p>
 *
 * <p>Item database files come from the workspace context if it names any,
 * then from the project file, then from conventional locations under the
 * workspace root (or the map's directory).</p>
 */
public final class VersionResolver
{
    static final List<String> ITEMS_OTB_CANDIDATES = List.of("items.otb", "data/items/items.otb");
    static final List<String> ITEMS_XML_CANDIDATES = List.of("items.xml", "data/items/items.xml");

    private final ProjectMetadataReader metadataReader;

    public VersionResolver() {
        this(new ProjectMetadataReader());
    }

    public VersionResolver(ProjectMetadataReader metadataReader) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader");
    }

    // =========================================================================
    // Hints
    // =========================================================================

    public WorkspaceHints gatherHints(Optional<Path> mapFile, WorkspaceContext workspace, IssueCollector issues)
    {
        Optional<ProjectMetadata> project = Optional.empty();
        if (workspace.readProjectMetadata() && mapFile.isPresent()) {
            project = readProject(mapFile.get(), issues);
        }

        OptionalInt clientVersion = workspace.clientVersionHint();
        if (clientVersion.isEmpty() && project.isPresent()) {
            clientVersion = project.get().clientVersion();
        }

        ServerEngine engine = workspace.engineHint();
        if (engine == ServerEngine.UNKNOWN && project.isPresent()) {
            engine = project.get().engine();
        }

        ItemDatabaseFiles files = workspace.databaseFiles();
        if (files.isEmpty() && project.isPresent()) {
            files = new ItemDatabaseFiles(project.get().itemsOtb(), project.get().itemsXml());
        }
        if (files.isEmpty()) {
            Optional<Path> root = workspace.workspaceRoot()
                    .or(() -> mapFile.map(p -> p.toAbsolutePath().getParent()));
            if (root.isPresent()) {
                files = new ItemDatabaseFiles(firstExisting(root.get(), ITEMS_OTB_CANDIDATES), firstExisting(root.get(), ITEMS_XML_CANDIDATES));
            }
        }

        return new WorkspaceHints(clientVersion, engine, files);
    }

    private Optional<ProjectMetadata> readProject(Path mapFile, IssueCollector issues)
    {
        Optional<Path> projectFile = metadataReader.locate(mapFile);
        if (projectFile.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(metadataReader.read(projectFile.get()));
        }
        catch (ProjectMetadataException e) {
            issues.report(MapIoIssue.of(IssueCode.PROJECT_METADATA_ERROR, e.getMessage()));
            return Optional.empty();
        }
    }

    private static Optional<Path> firstExisting(Path root, List<String> candidates)
    {
        for (String candidate : candidates) {
            Path p = root.resolve(candidate);
            if (Files.isRegularFile(p)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Load
    // =========================================================================

    /**
     * Resolves the format of a file whose root header declares {@code headerVersion}.
     *
     * @throws VersionUnsupportedException if the version is unknown and not allowed
     */
    public FormatDescriptor resolveForLoad(long headerVersion, WorkspaceHints hints,
                                           Optional<ItemDatabase> database,
                                           boolean allowUnsupported, IssueCollector issues)
    {
        Optional<OtbmVersion> known = OtbmVersion.fromWire(headerVersion);
        OtbmVersion version;
        if (known.isPresent()) {
            version = known.get();
        } else if (allowUnsupported && headerVersion > OtbmVersion.latest().wireValue()) {
            version = OtbmVersion.latest();
            issues.report(MapIoIssue.of(IssueCode.UNSUPPORTED_VERSION_ACCEPTED,
                    "map version " + headerVersion + " is newer than supported; reading as " + version));
        } else {
            throw new VersionUnsupportedException(headerVersion);
        }

        Optional<IdSpace> hinted = hints.engine().idSpace();
        if (hinted.isPresent() && hinted.get() != version.idSpace()) {
            issues.report(MapIoIssue.of(IssueCode.VERSION_HINT_MISMATCH,
                    "workspace declares " + hints.engine() + " but the map header says " + version
                            + " (" + version.idSpace() + " ids); using the header"));
        }

        int clientVersion = hints.clientVersion().orElse(database.map(ItemDatabase::clientVersion).orElse(0));
        return new FormatDescriptor(version, version.usesClientId(), clientVersion,
                hints.databaseFiles(), ResolutionSource.FILE_HEADER);
    }

    // =========================================================================
    // Save target
    // =========================================================================

    /**
     * Chooses the format a map should be written in when the caller did not
     * name one.
     */
    public FormatDescriptor resolveForSave(Optional<MapHeader> header, WorkspaceHints hints,
                                           Optional<ItemDatabase> database)
    {
        OptionalInt hintedClient = hints.clientVersion();
        if (hintedClient.isPresent()) {
            int cv = hintedClient.getAsInt();
            OtbmVersion v = OtbmVersion.forClient(cv, idSpaceFor(hints.engine(), cv));
            return descriptor(v, cv, hints, ResolutionSource.WORKSPACE_HINT);
        }

        if (header.isPresent()) {
            Optional<OtbmVersion> v = OtbmVersion.fromWire(header.get().otbmVersion());
            if (v.isPresent()) {
                int cv = database.map(ItemDatabase::clientVersion).orElse(0);
                return descriptor(v.get(), cv, hints, ResolutionSource.FILE_HEADER);
            }
        }

        int dbClient = database.map(ItemDatabase::clientVersion).orElse(0);
        if (dbClient > 0) {
            OtbmVersion v = OtbmVersion.forClient(dbClient, idSpaceFor(hints.engine(), dbClient));
            return descriptor(v, dbClient, hints, ResolutionSource.ITEM_DATABASE);
        }

        OtbmVersion fallback = hints.engine() == ServerEngine.CANARY && database.isPresent()
                ? OtbmVersion.V6
                : OtbmVersion.V4;
        return descriptor(fallback, 0, hints, ResolutionSource.FALLBACK);
    }

    private static FormatDescriptor descriptor(OtbmVersion v, int clientVersion, WorkspaceHints hints,
                                               ResolutionSource source) {
        return new FormatDescriptor(v, v.usesClientId(), clientVersion, hints.databaseFiles(), source);
    }

    /**
     * Id space for a client version when the engine is unknown: from 13.00 on,
     * map files are normally written in client ids.
     */
    static IdSpace idSpaceFor(ServerEngine engine, int clientVersion) {
        return engine.idSpace().orElse(clientVersion >= 1300 ? IdSpace.CLIENT : IdSpace.SERVER);
    }
}
