package com.questrail.tilemap.storage.otbm.codec;

/**
 * Raised by {@link PayloadReader} when a field extends past the payload end.
 *
 * <p>Callers decide whether the shortfall is recoverable for the field being
 * read; the reader itself has no notion of severity.</p>
 */
public final class TruncatedPayloadException extends RuntimeException
{
    public TruncatedPayloadException(int needed, int available) {
        super("needed " + needed + " byte(s), " + available + " available");
    }
}
