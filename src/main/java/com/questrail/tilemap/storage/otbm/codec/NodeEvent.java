package com.questrail.tilemap.storage.otbm.codec;

/**
 * One step of a depth-first walk over a node tree.
 */
public sealed interface NodeEvent
{
    int type();

    /**
     * Nesting depth of the node, the root being at depth one.
     */
    int depth();

    /**
     * A node was opened.
     *
     * <p>{@code payload} holds the unescaped payload bytes and belongs to the
     * receiver. {@code hasChildren} tells whether a child node follows the
     * payload.</p>
     *
     * @param offset byte offset of the node-start marker in the source
     */
    record Start(int type, int depth, long offset, byte[] payload, boolean hasChildren) implements NodeEvent {}

    /**
     * The most recently opened node that is still open was closed.
     */
    record End(int type, int depth, long offset) implements NodeEvent {}
}
