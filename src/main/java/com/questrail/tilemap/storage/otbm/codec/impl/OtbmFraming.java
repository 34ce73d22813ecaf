package com.questrail.tilemap.storage.otbm.codec.impl;

/**
 * OtbmFraming
 * -----------------------------------------------------------------------------
 * Marker values of the node-tree wire format.
 *
 * <p>A node is framed as:</p>
 * <pre>
 *   NODE_START  type  payload...  [child nodes]  NODE_END
 * </pre>
 *
 * <p>The three marker values never appear bare inside a payload: each
 * occurrence is preceded by {@link #ESCAPE}. The node type byte directly
 * follows {@link #NODE_START} and is not escaped.</p>
 */
public final class OtbmFraming
{
    /** Escape byte ($FD). */
    public static final int ESCAPE = 0xFD;

    /** Opens a node ($FE). */
    public static final int NODE_START = 0xFE;

    /** Closes the innermost open node ($FF). */
    public static final int NODE_END = 0xFF;

    private OtbmFraming() {}

    public static boolean isMarker(int b) {
        return b == ESCAPE || b == NODE_START || b == NODE_END;
    }
}
