package com.questrail.tilemap.api;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A node subtree whose type was not recognised on load.
 *
 * <p>It is kept verbatim (type, logical payload and children) on the entity
 * that owned it and written back in place, so newer map features survive an
 * older reader.</p>
 */
public final class OpaqueNode
{
    private final int type;
    private final byte[] payload;
    private final List<OpaqueNode> children;

    public OpaqueNode(int type, byte[] payload, List<OpaqueNode> children) {
        if (type < 0 || type > 0xFF) {
            throw new IllegalArgumentException("type out of range: " + type);
        }
        this.type = type;
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.children = List.copyOf(children);
    }

    public int type() {
        return type;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public List<OpaqueNode> children() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpaqueNode)) return false;
        OpaqueNode that = (OpaqueNode) o;
        return type == that.type && Arrays.equals(payload, that.payload) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type + Arrays.hashCode(payload)) + children.hashCode();
    }

    @Override
    public String toString() {
        return String.format("OpaqueNode{type=0x%02X, payload=%d bytes, children=%d}",
                type, payload.length, children.size());
    }
}
