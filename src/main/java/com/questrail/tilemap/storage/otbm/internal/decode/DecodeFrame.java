package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.OpaqueNode;
import com.questrail.tilemap.storage.otbm.format.NodeKind;

import java.util.Optional;

/**
 * DecodeFrame
 * -----------------------------------------------------------------------------
 * State kept for one open node while its children are being read.
 *
 * <p>Frames form an explicit stack owned by the assembler. A frame is created
 * by a {@link NodeDecoder} when its node opens (the payload is decoded at that
 * point) and is {@link #close closed} when the node's end marker is read.
 * Frames that produce an entity hand it to their parent frame, or to the map
 * in the {@link DecodeContext}, when they close.</p>
 */
public abstract class DecodeFrame
{
    private final NodeKind kind;

    protected DecodeFrame(NodeKind kind) {
        this.kind = kind;
    }

    /**
     * The recognised kind of this node; empty for preserved and skipped nodes.
     */
    public Optional<NodeKind> kind() {
        return Optional.ofNullable(kind);
    }

    /**
     * True when unknown children of this node are kept as {@link OpaqueNode}s
     * rather than dropped.
     */
    public boolean keepsOpaqueChildren() {
        return false;
    }

    public void acceptOpaque(OpaqueNode node) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not keep opaque children");
    }

    public void close(DecodeContext ctx) {
    }
}
