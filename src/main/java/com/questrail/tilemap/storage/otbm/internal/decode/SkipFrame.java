package com.questrail.tilemap.storage.otbm.internal.decode;

/**
 * Frame of a subtree that is read past and discarded. Every descendant gets
 * this frame as well.
 */
final class SkipFrame extends DecodeFrame
{
    static final SkipFrame INSTANCE = new SkipFrame();

    private SkipFrame() {
        super(null);
    }
}
