package com.questrail.tilemap.storage.otbm.runtime;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.database.ItemDatabaseLoader;
import com.questrail.tilemap.storage.otbm.config.MapIoConfig;
import com.questrail.tilemap.storage.otbm.error.MapFormatException;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.internal.decode.NodeDecoderTable;
import com.questrail.tilemap.storage.otbm.observability.LoadCompletedEvent;
import com.questrail.tilemap.storage.otbm.observability.MapIoErrorEvent;
import com.questrail.tilemap.storage.otbm.observability.MapIoObservabilitySink;
import com.questrail.tilemap.storage.otbm.observability.NullObservabilitySink;
import com.questrail.tilemap.storage.otbm.observability.SaveCompletedEvent;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.LoadReport;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.report.MapIoFailure;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.report.SaveReport;
import com.questrail.tilemap.storage.otbm.report.SaveStatistics;
import com.questrail.tilemap.storage.otbm.version.VersionResolver;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;
import com.questrail.tilemap.storage.otbm.version.WorkspaceHints;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * OtbmMapStorage
 * =============================================================================
 * Composition root and public entry point of the map storage engine.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@code load} and {@code save} never throw for a bad file or an
 *       unrepresentable map: every outcome is a {@link LoadReport} or
 *       {@link SaveReport}, fatal ones carrying a {@link MapIoFailure}.</li>
 *   <li>A failed load returns no map; a failed save leaves the destination
 *       file as it was.</li>
 *   <li>The instance holds no per-call state. Independent loads and saves may
 *       run concurrently on different threads; saving a map that another
 *       thread is mutating is the caller's problem.</li>
 * </ul>
 */
public final class OtbmMapStorage {
    private final MapIoConfig config;
    private final VersionResolver resolver;
    private final ItemDatabaseLoader databaseLoader;
    private final NodeDecoderTable decoders;
    private final GameMapSerializer serializer;
    private final MapIoObservabilitySink observabilitySink;
    private final Clock clock;

    private OtbmMapStorage(Builder b) {
        this.config = b.config;
        this.resolver = b.resolver;
        this.databaseLoader = b.databaseLoader;
        this.decoders = b.decoders;
        this.serializer = b.serializer;
        this.observabilitySink = b.observabilitySink;
        this.clock = b.clock;
    }

    public static OtbmMapStorage createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MapIoConfig config() {
        return config;
    }

    // =========================================================================
    // Load
    // =========================================================================

    public LoadResult load(Path file, WorkspaceContext workspace) {
        return load(file, workspace, CancellationToken.NONE);
    }

    public LoadResult load(Path file, WorkspaceContext workspace, CancellationToken cancellation)
    {
        Objects.requireNonNull(file, "file");
        IssueCollector issues = new IssueCollector(config.issueLimitPerCode());
        GameMapAssembler assembler = newAssembler(issues);
        Instant started = clock.instant();

        LoadResult result;
        try (InputStream in = Files.newInputStream(file)) {
            GameMapAssembler.Assembly assembly =
                    assembler.assemble(in, Files.size(file), Optional.of(file), workspace, cancellation);
            result = succeeded(assembly, assembler, issues);
        }
        catch (MapFormatException e) {
            result = failed(file.toString(), assembler, issues, e.toFailure(), e);
        }
        catch (IOException e) {
            result = failed(file.toString(), assembler, issues,
                    new MapIoFailure.IoFailure("cannot read " + file + ": " + e.getMessage(), e), e);
        }
        observabilitySink.onLoadCompleted(new LoadCompletedEvent(clock.instant(), file.toString(),
                Duration.between(started, clock.instant()), result.report()));
        return result;
    }

    /**
     * Loads from an anonymous stream. Project files and item database files
     * are only found through {@code workspace}; the stream is not closed.
     */
    public LoadResult load(InputStream source, WorkspaceContext workspace, CancellationToken cancellation)
    {
        Objects.requireNonNull(source, "source");
        IssueCollector issues = new IssueCollector(config.issueLimitPerCode());
        GameMapAssembler assembler = newAssembler(issues);
        Instant started = clock.instant();

        LoadResult result;
        try {
            GameMapAssembler.Assembly assembly =
                    assembler.assemble(source, -1, Optional.empty(), workspace, cancellation);
            result = succeeded(assembly, assembler, issues);
        }
        catch (MapFormatException e) {
            result = failed("<stream>", assembler, issues, e.toFailure(), e);
        }
        catch (IOException e) {
            result = failed("<stream>", assembler, issues,
                    new MapIoFailure.IoFailure("cannot read map stream: " + e.getMessage(), e), e);
        }
        observabilitySink.onLoadCompleted(new LoadCompletedEvent(clock.instant(), "<stream>",
                Duration.between(started, clock.instant()), result.report()));
        return result;
    }

    private GameMapAssembler newAssembler(IssueCollector issues) {
        return new GameMapAssembler(config, resolver, databaseLoader, decoders, issues);
    }

    private static LoadResult succeeded(GameMapAssembler.Assembly assembly, GameMapAssembler assembler,
                                        IssueCollector issues) {
        LoadReport report = LoadReport.succeeded(issues, assembly.context().descriptor(), assembler.statistics());
        return new LoadResult(Optional.of(assembly.map()), Optional.of(assembly.context()), report);
    }

    private LoadResult failed(String source, GameMapAssembler assembler, IssueCollector issues,
                              MapIoFailure failure, Throwable cause) {
        observabilitySink.onError(new MapIoErrorEvent(clock.instant(), "load", source, failure, cause));
        return LoadResult.failed(LoadReport.failed(issues, failure, assembler.format(), assembler.statistics()));
    }

    // =========================================================================
    // Save
    // =========================================================================

    /**
     * Saves {@code map} to {@code destination} in the format {@code context}
     * names, typically the context returned by the load of the same map.
     */
    public SaveReport save(GameMap map, Path destination, FormatContext context)
    {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(context, "context");
        IssueCollector issues = new IssueCollector(config.issueLimitPerCode());
        Instant started = clock.instant();

        SaveReport report;
        try {
            SaveStatistics statistics = serializer.save(map, destination, context, issues);
            report = SaveReport.succeeded(issues, statistics);
        }
        catch (MapFormatException e) {
            report = failedSave(destination, issues, e.toFailure(), e);
        }
        catch (IOException e) {
            report = failedSave(destination, issues,
                    new MapIoFailure.IoFailure("cannot write " + destination + ": " + e.getMessage(), e), e);
        }
        observabilitySink.onSaveCompleted(new SaveCompletedEvent(clock.instant(), destination.toString(),
                context.version(), Duration.between(started, clock.instant()), report));
        return report;
    }

    /**
     * Saves a map that has no format context of its own, e.g. a new map,
     * in the format {@link #resolveTarget} picks.
     */
    public SaveReport save(GameMap map, Path destination, WorkspaceContext workspace) {
        return save(map, destination, resolveTarget(map, Optional.of(destination), workspace));
    }

    private SaveReport failedSave(Path destination, IssueCollector issues, MapIoFailure failure, Throwable cause) {
        observabilitySink.onError(new MapIoErrorEvent(clock.instant(), "save", destination.toString(), failure, cause));
        return SaveReport.failed(issues, failure);
    }

    /**
     * Chooses a save format from the workspace hints, the map header and the
     * item database, in that order. Problems reading project or database
     * files only weaken the choice; they are not reported.
     */
    public FormatContext resolveTarget(GameMap map, Optional<Path> destination, WorkspaceContext workspace)
    {
        IssueCollector ignored = new IssueCollector(config.issueLimitPerCode());
        WorkspaceHints hints = resolver.gatherHints(destination, workspace, ignored);
        Optional<ItemDatabase> database = workspace.itemDatabase().or(() -> databaseLoader.load(hints.databaseFiles(),
                problem -> ignored.report(MapIoIssue.of(IssueCode.ITEM_DATABASE_ERROR, problem))));
        FormatDescriptor descriptor = resolver.resolveForSave(Optional.of(map.header()), hints, database);
        return FormatContext.of(descriptor, database);
    }

    public static final class Builder {
        private MapIoConfig config = MapIoConfig.defaults();
        private VersionResolver resolver = new VersionResolver();
        private ItemDatabaseLoader databaseLoader = new ItemDatabaseLoader();
        private NodeDecoderTable decoders = NodeDecoderTable.standard();
        private GameMapSerializer serializer = new GameMapSerializer();
        private MapIoObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(MapIoConfig config) {
            this.config = config;
            return this;
        }

        public Builder withVersionResolver(VersionResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder withItemDatabaseLoader(ItemDatabaseLoader loader) {
            this.databaseLoader = loader;
            return this;
        }

        public Builder withDecoderTable(NodeDecoderTable decoders) {
            this.decoders = decoders;
            return this;
        }

        public Builder withSerializer(GameMapSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder withObservabilitySink(MapIoObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public OtbmMapStorage build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(resolver, "resolver");
            Objects.requireNonNull(databaseLoader, "databaseLoader");
            Objects.requireNonNull(decoders, "decoders");
            Objects.requireNonNull(serializer, "serializer");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            return new OtbmMapStorage(this);
        }
    }
}
