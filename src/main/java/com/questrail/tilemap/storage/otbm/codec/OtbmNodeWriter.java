package com.questrail.tilemap.storage.otbm.codec;

import java.io.IOException;

/**
 * Writes a node tree incrementally.
 *
 * <p>Calls follow the tree: {@link #startNode(int)}, at most one payload block
 * sequence via {@link #writePayload(byte[])} before the first child, children,
 * then {@link #endNode()}. Payload bytes are escaped as they are written.</p>
 */
public interface OtbmNodeWriter
{
    void startNode(int type) throws IOException;

    void writePayload(byte[] logical) throws IOException;

    void endNode() throws IOException;

    int depth();

    /**
     * Bytes emitted for the node tree so far.
     */
    long bytesWritten();
}
