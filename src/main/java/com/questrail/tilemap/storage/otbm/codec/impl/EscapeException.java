package com.questrail.tilemap.storage.otbm.codec.impl;

/**
 * Indicates an escaped byte region that does not decode to a payload.
 */
public final class EscapeException extends Exception
{
    private final String reason;
    private final int index;

    public EscapeException(String reason, int index) {
        super(reason + " at index " + index);
        this.reason = reason;
        this.index = index;
    }

    public String reason() {
        return reason;
    }

    public int index() {
        return index;
    }
}
