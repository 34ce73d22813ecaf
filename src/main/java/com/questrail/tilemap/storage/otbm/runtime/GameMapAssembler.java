package com.questrail.tilemap.storage.otbm.runtime;

import com.questrail.tilemap.api.FileIdentifier;
import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.House;
import com.questrail.tilemap.api.MapHeader;
import com.questrail.tilemap.api.SpawnArea;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.database.ItemDatabaseLoader;
import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.codec.OtbmNodeReader;
import com.questrail.tilemap.storage.otbm.codec.PayloadReader;
import com.questrail.tilemap.storage.otbm.codec.impl.DefaultOtbmNodeReader;
import com.questrail.tilemap.storage.otbm.config.MapIoConfig;
import com.questrail.tilemap.storage.otbm.error.ItemDatabaseUnavailableException;
import com.questrail.tilemap.storage.otbm.error.StructuralCorruptionException;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.internal.decode.DecodeContext;
import com.questrail.tilemap.storage.otbm.internal.decode.DecodeFrame;
import com.questrail.tilemap.storage.otbm.internal.decode.ItemIdResolver;
import com.questrail.tilemap.storage.otbm.internal.decode.NodeDecoderTable;
import com.questrail.tilemap.storage.otbm.internal.decode.ResourceGuard;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.LoadStatistics;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.version.MapFileDetection;
import com.questrail.tilemap.storage.otbm.version.MapFileKind;
import com.questrail.tilemap.storage.otbm.version.MapFileSniffer;
import com.questrail.tilemap.storage.otbm.version.VersionResolver;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;
import com.questrail.tilemap.storage.otbm.version.WorkspaceHints;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * GameMapAssembler
 * =============================================================================
 * Builds a {@link GameMap} from a map byte stream in a single pass.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>identify the file from its first six bytes; an unrecognised
 *       identifier in front of a valid root node is accepted with a warning</li>
 *   <li>read the root header and resolve the format from it</li>
 *   <li>load the item database; a ClientID file cannot be read without one</li>
 *   <li>stream node events through the {@link NodeDecoderTable}, keeping one
 *       {@link DecodeFrame} per open node on an explicit stack</li>
 *   <li>reject trailing data after the root node</li>
 *   <li>attach houses and spawn areas supplied by the workspace</li>
 * </ol>
 *
 * <p>An assembler serves one load and is confined to the calling thread.
 * {@link #statistics()} and {@link #format()} remain available after a
 * failure, describing how far the load got.</p>
 */
public final class GameMapAssembler
{
    /**
     * A fully read map and the format context it was read with.
     */
    public record Assembly(GameMap map, FormatContext context) {}

    // Tile areas, towns and waypoints sit at depth 3, below root and map data.
    private static final int CANCELLATION_CHECK_DEPTH = 3;

    private static final int ROOT_HEADER_BYTES = 16;

    private final MapIoConfig config;
    private final VersionResolver resolver;
    private final ItemDatabaseLoader databaseLoader;
    private final NodeDecoderTable decoders;
    private final IssueCollector issues;
    private final ResourceGuard guard;
    private final MapFileSniffer sniffer = new MapFileSniffer();

    private OtbmNodeReader reader;
    private FormatDescriptor format;

    public GameMapAssembler(MapIoConfig config, VersionResolver resolver, ItemDatabaseLoader databaseLoader,
                            NodeDecoderTable decoders, IssueCollector issues) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.databaseLoader = Objects.requireNonNull(databaseLoader, "databaseLoader");
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.issues = Objects.requireNonNull(issues, "issues");
        this.guard = new ResourceGuard(config.limits(), issues);
    }

    /**
     * @param source    the whole map file, positioned at its first byte
     * @param fileSize  size of the file in bytes, or -1 when unknown
     * @param mapFile   path of the file, used to locate the project file and
     *                  item database; empty for anonymous streams
     * @throws com.questrail.tilemap.storage.otbm.error.MapFormatException on any fatal condition
     * @throws IOException when the source cannot be read
     */
    public Assembly assemble(InputStream source, long fileSize, Optional<Path> mapFile,
                             WorkspaceContext workspace, CancellationToken cancellation) throws IOException
    {
        if (fileSize >= 0) {
            guard.checkFileSize(fileSize);
        }
        WorkspaceHints hints = resolver.gatherHints(mapFile, workspace, issues);

        BufferedInputStream in = new BufferedInputStream(source, 64 * 1024);
        FileIdentifier identifier = readIdentifier(in);

        reader = new DefaultOtbmNodeReader(in, FileIdentifier.LENGTH, NodeKind::describe,
                config.limits().maxPayloadBytes(), config.limits().maxNodeDepth());

        // The sniffer has already checked that a root node starts here.
        NodeEvent.Start root = (NodeEvent.Start) reader.next().orElseThrow();
        PayloadReader header = new PayloadReader(root.payload());
        if (header.readableBytes() < ROOT_HEADER_BYTES) {
            throw new StructuralCorruptionException("root header needs " + ROOT_HEADER_BYTES + " bytes, found "
                    + header.readableBytes(), root.offset(), reader.currentPath());
        }
        final long headerVersion = header.readU32();
        final int width = header.readU16();
        final int height = header.readU16();
        final long itemsMajor = header.readU32();
        final long itemsMinor = header.readU32();
        if (header.isReadable()) {
            issues.report(MapIoIssue.of(IssueCode.MALFORMED_NODE,
                    header.readableBytes() + " unexpected bytes after the root header ignored"));
        }

        Optional<ItemDatabase> database = workspace.itemDatabase().or(() -> databaseLoader.load(hints.databaseFiles(),
                problem -> issues.report(MapIoIssue.of(IssueCode.ITEM_DATABASE_ERROR, problem))));

        format = resolver.resolveForLoad(headerVersion, hints, database, config.allowUnsupportedVersions(), issues);
        OtbmVersion version = format.version();
        if (version.usesClientId() && database.isEmpty()) {
            throw new ItemDatabaseUnavailableException("map version " + version
                    + " stores client ids; an item database (items.otb) is required to read it");
        }

        GameMap map = new GameMap(MapHeader.builder()
                .withIdentifier(identifier)
                .withOtbmVersion(headerVersion)
                .withDimensions(width, height)
                .withItemsVersion(itemsMajor, itemsMinor)
                .build());

        ItemIdResolver ids = new ItemIdResolver(version.idSpace(), database.orElse(null),
                config.unknownItemPolicy(), config.placeholderItemId(), issues);
        DecodeContext ctx = new DecodeContext(map, version, database.orElse(null), ids, issues, guard,
                reader::currentPath);

        walk(ctx, cancellation);
        reader.requireEndOfStream();

        attachWorkspaceEntities(map, workspace);
        return new Assembly(map, FormatContext.of(format, database));
    }

    private FileIdentifier readIdentifier(BufferedInputStream in) throws IOException
    {
        in.mark(MapFileSniffer.HEAD_LENGTH);
        byte[] head = in.readNBytes(MapFileSniffer.HEAD_LENGTH);
        in.reset();

        MapFileDetection detection = sniffer.detect(head);
        if (detection.kind() != MapFileKind.OTBM) {
            throw new StructuralCorruptionException("not a map file: " + detection.reason(), 0, "/");
        }
        if (detection.mislabeled()) {
            issues.report(MapIoIssue.of(IssueCode.MISLABELED_IDENTIFIER,
                    String.format("unrecognised file identifier %02X %02X %02X %02X; read as a map anyway",
                            head[0], head[1], head[2], head[3])));
        }
        in.skipNBytes(FileIdentifier.LENGTH);
        return detection.identifier().orElseThrow();
    }

    private void walk(DecodeContext ctx, CancellationToken cancellation) throws IOException
    {
        Deque<DecodeFrame> frames = new ArrayDeque<>();
        frames.push(NodeDecoderTable.rootFrame());

        Optional<NodeEvent> event;
        while ((event = reader.next()).isPresent()) {
            NodeEvent e = event.get();
            if (e instanceof NodeEvent.Start) {
                NodeEvent.Start start = (NodeEvent.Start) e;
                if (start.depth() == CANCELLATION_CHECK_DEPTH) {
                    cancellation.throwIfCancellationRequested();
                }
                frames.push(decoders.open(frames.peek(), start, ctx));
            } else {
                frames.pop().close(ctx);
            }
        }
    }

    private void attachWorkspaceEntities(GameMap map, WorkspaceContext workspace)
    {
        for (House house : workspace.houses()) {
            map.putHouse(house);
        }
        for (SpawnArea area : workspace.spawnAreas()) {
            map.addSpawnArea(area);
        }
        // One warning per house id, not per tile.
        for (Integer id : map.danglingHouseIds()) {
            issues.report(MapIoIssue.at(IssueCode.DANGLING_HOUSE_REFERENCE,
                    "house " + id + " is referenced by " + map.houseTiles(id).size()
                            + " tile(s) but not defined in the house list",
                    map.houseTiles(id).first()));
        }
    }

    public Optional<FormatDescriptor> format() {
        return Optional.ofNullable(format);
    }

    public LoadStatistics statistics()
    {
        if (reader == null) {
            return LoadStatistics.EMPTY;
        }
        return new LoadStatistics(reader.offset(), guard.tileAreas(), (int) guard.tiles(), guard.items(),
                reader.largestPayload(), reader.deepestNesting());
    }
}
