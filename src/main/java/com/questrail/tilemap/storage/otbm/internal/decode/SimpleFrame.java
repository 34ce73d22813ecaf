package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.storage.otbm.format.NodeKind;

/**
 * Frame of a node whose payload is fully handled when it opens, or that only
 * groups its children.
 */
final class SimpleFrame extends DecodeFrame
{
    SimpleFrame(NodeKind kind) {
        super(kind);
    }
}
