package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;

/**
 * Decodes the payload of one node kind under one parent kind and returns the
 * frame that will receive its children.
 */
@FunctionalInterface
public interface NodeDecoder
{
    DecodeFrame open(DecodeFrame parent, NodeEvent.Start node, DecodeContext ctx);
}
