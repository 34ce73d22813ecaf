package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * NodeDecoderTable
 * =============================================================================
 * Dispatches each opened node to the {@link NodeDecoder} registered for its
 * (parent kind, child kind) pair.
 *
 * <h2>Unregistered children</h2>
 * <ul>
 *   <li>under a frame that {@link DecodeFrame#keepsOpaqueChildren() keeps
 *       opaque children} (map data, tiles): preserved as an opaque node and
 *       reported as {@link IssueCode#UNKNOWN_NODE}</li>
 *   <li>anywhere else: skipped with its subtree and reported the same way</li>
 *   <li>inside a preserved or skipped subtree: handled like their parent,
 *       without further reports</li>
 * </ul>
 *
 * <p>Supporting a new node kind or a new placement of an existing one means
 * registering another decoder; dispatch itself does not change.</p>
 */
public final class NodeDecoderTable
{
    private final Map<NodeKind, Map<NodeKind, NodeDecoder>> decoders;

    private NodeDecoderTable(Map<NodeKind, Map<NodeKind, NodeDecoder>> decoders) {
        this.decoders = decoders;
    }

    /**
     * Decoders for every node placement the engine reads.
     */
    public static NodeDecoderTable standard()
    {
        return builder()
                .register(NodeKind.ROOT, NodeKind.MAP_DATA, StandardDecoders::mapData)
                .register(NodeKind.MAP_DATA, NodeKind.TILE_AREA, StandardDecoders::tileArea)
                .register(NodeKind.MAP_DATA, NodeKind.TOWNS, StandardDecoders::towns)
                .register(NodeKind.MAP_DATA, NodeKind.WAYPOINTS, StandardDecoders::waypoints)
                .register(NodeKind.MAP_DATA, NodeKind.SPAWNS, StandardDecoders::spawns)
                .register(NodeKind.TILE_AREA, NodeKind.TILE, StandardDecoders::tile)
                .register(NodeKind.TILE_AREA, NodeKind.HOUSETILE, StandardDecoders::tile)
                .register(NodeKind.TILE, NodeKind.ITEM, StandardDecoders::item)
                .register(NodeKind.TILE, NodeKind.TILE_ZONE, StandardDecoders::tileZone)
                .register(NodeKind.HOUSETILE, NodeKind.ITEM, StandardDecoders::item)
                .register(NodeKind.HOUSETILE, NodeKind.TILE_ZONE, StandardDecoders::tileZone)
                .register(NodeKind.ITEM, NodeKind.ITEM, StandardDecoders::item)
                .register(NodeKind.TOWNS, NodeKind.TOWN, StandardDecoders::town)
                .register(NodeKind.WAYPOINTS, NodeKind.WAYPOINT, StandardDecoders::waypoint)
                .register(NodeKind.SPAWNS, NodeKind.SPAWN_AREA, StandardDecoders::spawnArea)
                .register(NodeKind.SPAWN_AREA, NodeKind.MONSTER, StandardDecoders::monster)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<NodeDecoder> find(NodeKind parent, NodeKind child) {
        Map<NodeKind, NodeDecoder> children = decoders.get(parent);
        return children == null ? Optional.empty() : Optional.ofNullable(children.get(child));
    }

    /**
     * Opens {@code node} under {@code parent} and returns the frame for its children.
     */
    public DecodeFrame open(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx)
    {
        if (parent instanceof SkipFrame) {
            return SkipFrame.INSTANCE;
        }
        if (parent instanceof OpaqueFrame) {
            return new OpaqueFrame(parent, node.type(), node.payload());
        }

        Optional<NodeKind> child = NodeKind.fromType(node.type());
        if (parent.kind().isPresent() && child.isPresent()) {
            Optional<NodeDecoder> decoder = find(parent.kind().get(), child.get());
            if (decoder.isPresent()) {
                return decoder.get().open(parent, node, ctx);
            }
        }

        String what = "unknown node " + ctx.nodePath();
        if (parent.keepsOpaqueChildren()) {
            ctx.report(MapIoIssue.of(IssueCode.UNKNOWN_NODE, what + " kept verbatim"));
            return new OpaqueFrame(parent, node.type(), node.payload());
        }
        ctx.report(MapIoIssue.of(IssueCode.UNKNOWN_NODE, what + " skipped"));
        return SkipFrame.INSTANCE;
    }

    /**
     * Frame for the root node, which the assembler decodes itself.
     */
    public static DecodeFrame rootFrame() {
        return new SimpleFrame(NodeKind.ROOT);
    }

    public static final class Builder
    {
        private final Map<NodeKind, Map<NodeKind, NodeDecoder>> decoders = new EnumMap<>(NodeKind.class);

        public Builder register(NodeKind parent, NodeKind child, NodeDecoder decoder) {
            decoders.computeIfAbsent(parent, k -> new EnumMap<>(NodeKind.class))
                    .put(child, Objects.requireNonNull(decoder, "decoder"));
            return this;
        }

        public NodeDecoderTable build() {
            Map<NodeKind, Map<NodeKind, NodeDecoder>> copy = new EnumMap<>(NodeKind.class);
            decoders.forEach((parent, children) -> copy.put(parent, new EnumMap<>(children)));
            return new NodeDecoderTable(copy);
        }
    }
}
