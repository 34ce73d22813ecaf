package com.questrail.tilemap.storage.otbm.codec;

import java.io.IOException;
import java.util.Optional;

/**
 * OtbmNodeReader
 * -----------------------------------------------------------------------------
 * Streams a node tree as {@link NodeEvent}s.
 *
 * <p>{@link #next()} yields a {@link NodeEvent.Start} for every node, followed
 * later by the matching {@link NodeEvent.End}, in document order. It returns
 * {@link Optional#empty()} once the root node has been closed.</p>
 */
public interface OtbmNodeReader
{
    Optional<NodeEvent> next() throws IOException;

    /**
     * Verifies that nothing follows the closed root node.
     */
    void requireEndOfStream() throws IOException;

    /**
     * Names of the currently open nodes, outermost first, separated by '/'.
     */
    String currentPath();

    /**
     * Offset of the next unread byte, relative to the start of the source.
     */
    long offset();

    int largestPayload();

    int deepestNesting();
}
