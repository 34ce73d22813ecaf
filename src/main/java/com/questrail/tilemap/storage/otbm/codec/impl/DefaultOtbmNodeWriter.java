package com.questrail.tilemap.storage.otbm.codec.impl;

import com.questrail.tilemap.storage.otbm.codec.OtbmNodeWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * DefaultOtbmNodeWriter
 * -----------------------------------------------------------------------------
 * Streaming implementation of {@link OtbmNodeWriter}.
 *
 * <p>This is the mechanical inverse of {@link DefaultOtbmNodeReader}: node
 * markers are written bare, payload bytes are escaped on the way out. Nothing
 * is buffered beyond what the target stream buffers.</p>
 */
public final class DefaultOtbmNodeWriter implements OtbmNodeWriter
{
    private final OutputStream out;
    private int depth;
    private boolean payloadOpen;
    private long bytesWritten;

    public DefaultOtbmNodeWriter(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void startNode(int type) throws IOException
    {
        if (type < 0 || type > 0xFF || OtbmFraming.isMarker(type)) {
            throw new IllegalArgumentException("invalid node type: " + type);
        }
        depth++;

        out.write(OtbmFraming.NODE_START);
        out.write(type);
        bytesWritten += 2;
        payloadOpen = true;
    }

    @Override
    public void writePayload(byte[] logical) throws IOException
    {
        if (!payloadOpen) {
            throw new IllegalStateException("payload must directly follow startNode");
        }
        bytesWritten += OtbmEscaping.writeEscaped(logical, out);
    }

    @Override
    public void endNode() throws IOException
    {
        if (depth == 0) {
            throw new IllegalStateException("no open node");
        }
        depth--;
        out.write(OtbmFraming.NODE_END);
        bytesWritten++;
        payloadOpen = false;
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public long bytesWritten() {
        return bytesWritten;
    }
}
