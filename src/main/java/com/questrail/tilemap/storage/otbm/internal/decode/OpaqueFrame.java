package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.OpaqueNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects an unrecognised subtree so it can be written back unchanged. On
 * close the finished {@link OpaqueNode} is handed to the parent frame.
 */
final class OpaqueFrame extends DecodeFrame
{
    private final DecodeFrame parent;
    private final int type;
    private final byte[] payload;
    private final List<OpaqueNode> children = new ArrayList<>();

    OpaqueFrame(DecodeFrame parent, int type, byte[] payload) {
        super(null);
        this.parent = Objects.requireNonNull(parent, "parent");
        this.type = type;
        this.payload = payload;
    }

    @Override
    public boolean keepsOpaqueChildren() {
        return true;
    }

    @Override
    public void acceptOpaque(OpaqueNode node) {
        children.add(node);
    }

    @Override
    public void close(DecodeContext ctx) {
        parent.acceptOpaque(new OpaqueNode(type, payload, children));
    }
}
