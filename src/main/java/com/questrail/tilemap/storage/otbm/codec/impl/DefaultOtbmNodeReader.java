package com.questrail.tilemap.storage.otbm.codec.impl;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.codec.OtbmNodeReader;
import com.questrail.tilemap.storage.otbm.error.ResourceLimitExceededException;
import com.questrail.tilemap.storage.otbm.error.StructuralCorruptionException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * DefaultOtbmNodeReader
 * -----------------------------------------------------------------------------
 * Streaming implementation of {@link OtbmNodeReader}.
 *
 * <p>The reader never recurses. Open nodes live in a fixed arena of frames
 * indexed by depth, sized by the nesting limit, so
 * arbitrarily deep or wide trees are walked with constant stack use.</p>
 *
 * <p>Per step the reader performs:</p>
 * <ol>
 *   <li>the marker that ended the previous payload (or the first byte of the
 *       source) decides whether a node opens or closes</li>
 *   <li>on open: read the type byte, then unescape the payload up to the next
 *       bare marker, which is remembered for the following step</li>
 *   <li>on close: pop the frame; unless the root closed, the next byte must be
 *       another marker</li>
 * </ol>
 *
 * <p>The input should be buffered; the reader pulls single bytes.</p>
 */
public final class DefaultOtbmNodeReader implements OtbmNodeReader
{
    public static final int DEFAULT_MAX_PAYLOAD = 16 * 1024 * 1024;
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final int BEFORE_ROOT = -2;
    private static final int NO_MARKER = -1;

    private final InputStream in;
    private final IntFunction<String> nodeNamer;
    private final int maxDepth;

    // Frame arena: index = depth - 1.
    private final int[] openTypes;
    private int depth;

    private int pendingMarker = BEFORE_ROOT;
    private boolean finished;
    private long offset;

    private final OtbmEscaping.Decoder payloads;
    private int largestPayload;
    private int deepestNesting;

    public DefaultOtbmNodeReader(InputStream in, long startOffset) {
        this(in, startOffset, DefaultOtbmNodeReader::hexName, DEFAULT_MAX_PAYLOAD, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param in          source positioned at the root node-start marker
     * @param startOffset offset of that marker within the whole file, for error reporting
     * @param nodeNamer   names node types in error paths
     * @param maxPayload  largest unescaped payload accepted, in bytes
     * @param maxDepth    deepest nesting accepted, the root counting as one
     */
    public DefaultOtbmNodeReader(InputStream in, long startOffset, IntFunction<String> nodeNamer,
                                 int maxPayload, int maxDepth) {
        this.in = Objects.requireNonNull(in, "in");
        this.nodeNamer = Objects.requireNonNull(nodeNamer, "nodeNamer");
        if (maxPayload <= 0 || maxDepth <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
        this.maxDepth = maxDepth;
        this.payloads = new OtbmEscaping.Decoder(maxPayload);
        this.openTypes = new int[maxDepth];
        this.offset = startOffset;
    }

    @Override
    public Optional<NodeEvent> next() throws IOException
    {
        if (finished) {
            return Optional.empty();
        }

        int marker = pendingMarker;
        if (marker == BEFORE_ROOT) {
            marker = readByte("stream ended before the root node");
            if (marker != OtbmFraming.NODE_START) {
                throw corruption(String.format("expected node start, found 0x%02X", marker), offset - 1);
            }
        }

        return Optional.of(marker == OtbmFraming.NODE_START ? openNode() : closeNode());
    }

    private NodeEvent.Start openNode() throws IOException
    {
        final long nodeOffset = offset - 1;
        if (depth >= maxDepth) {
            throw new ResourceLimitExceededException("node nesting depth", maxDepth, depth + 1L);
        }

        final int type = readByte("stream ended before node type");
        if (OtbmFraming.isMarker(type)) {
            throw corruption(String.format("marker 0x%02X where a node type was expected", type), offset - 1);
        }

        openTypes[depth] = type;
        depth++;
        deepestNesting = Math.max(deepestNesting, depth);

        final byte[] payload = readPayload();
        return new NodeEvent.Start(type, depth, nodeOffset, payload, pendingMarker == OtbmFraming.NODE_START);
    }

    private NodeEvent.End closeNode() throws IOException
    {
        final int closedDepth = depth;
        final int type = openTypes[--depth];
        final long endOffset = offset - 1;

        if (depth == 0) {
            finished = true;
            pendingMarker = NO_MARKER;
        } else {
            int b = in.read();
            if (b < 0) {
                throw corruption("stream ended inside " + currentPath(), offset);
            }
            offset++;
            if (b != OtbmFraming.NODE_START && b != OtbmFraming.NODE_END) {
                throw corruption(String.format("unexpected byte 0x%02X after node end", b), offset - 1);
            }
            pendingMarker = b;
        }
        return new NodeEvent.End(type, closedDepth, endOffset);
    }

    private byte[] readPayload() throws IOException
    {
        final long start = offset;
        final byte[] payload;
        try {
            payload = payloads.decode(in);
        }
        catch (EscapeException e) {
            offset = start + e.index();
            throw corruption(e.reason(), offset);
        }
        offset = start + payloads.consumed();
        pendingMarker = payloads.terminator();
        largestPayload = Math.max(largestPayload, payload.length);
        return payload;
    }

    private int readByte(String eofMessage) throws IOException
    {
        int b = in.read();
        if (b < 0) {
            throw corruption(eofMessage, offset);
        }
        offset++;
        return b;
    }

    @Override
    public void requireEndOfStream() throws IOException
    {
        if (!finished) {
            throw new IllegalStateException("root node is still open");
        }
        if (in.read() >= 0) {
            throw corruption("trailing data after the root node", offset);
        }
    }

    @Override
    public String currentPath()
    {
        if (depth == 0) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append('/').append(nodeNamer.apply(openTypes[i]));
        }
        return sb.toString();
    }

    @Override
    public long offset() {
        return offset;
    }

    @Override
    public int largestPayload() {
        return largestPayload;
    }

    @Override
    public int deepestNesting() {
        return deepestNesting;
    }

    private StructuralCorruptionException corruption(String message, long at) {
        return new StructuralCorruptionException(message, at, currentPath());
    }

    private static String hexName(int type) {
        return String.format("0x%02X", type);
    }
}
