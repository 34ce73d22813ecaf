package com.questrail.tilemap.storage.otbm.codec.impl;

import com.questrail.tilemap.storage.otbm.error.ResourceLimitExceededException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * OtbmEscaping
 * -----------------------------------------------------------------------------
 * The payload escape rule, shared by {@link DefaultOtbmNodeWriter} and
 * {@link DefaultOtbmNodeReader}.
 *
 * <ul>
 *   <li>Encode: a logical byte equal to one of the three markers is written as
 *       {@link OtbmFraming#ESCAPE} followed by the byte. Other bytes pass
 *       through.</li>
 *   <li>Decode: an escape byte is dropped and the byte after it is payload,
 *       whatever its value. A bare {@link OtbmFraming#NODE_START} or
 *       {@link OtbmFraming#NODE_END} ends the payload. An escape byte with
 *       nothing after it is corruption.</li>
 * </ul>
 */
public final class OtbmEscaping
{
    private OtbmEscaping() {}

    public static byte[] escape(byte[] logical)
    {
        int extra = 0;
        for (byte b : logical) {
            if (OtbmFraming.isMarker(b & 0xFF)) {
                extra++;
            }
        }
        if (extra == 0) {
            return logical.clone();
        }

        byte[] out = new byte[logical.length + extra];
        int w = 0;
        for (byte b : logical) {
            if (OtbmFraming.isMarker(b & 0xFF)) {
                out[w++] = (byte) OtbmFraming.ESCAPE;
            }
            out[w++] = b;
        }
        return out;
    }

    /**
     * Escapes {@code logical} onto {@code out}.
     *
     * @return the number of wire bytes written
     */
    public static int writeEscaped(byte[] logical, OutputStream out) throws IOException
    {
        byte[] wire = escape(logical);
        out.write(wire);
        return wire.length;
    }

    /**
     * Streaming decoder for one payload at a time. The buffer is reused between
     * payloads, so a decoder belongs to a single reader.
     */
    public static final class Decoder
    {
        private final int maxPayload;
        private byte[] buffer = new byte[256];
        private int terminator;
        private int consumed;

        public Decoder(int maxPayload) {
            if (maxPayload <= 0) {
                throw new IllegalArgumentException("maxPayload must be positive");
            }
            this.maxPayload = maxPayload;
        }

        /**
         * Reads and unescapes wire bytes up to and including the next bare
         * node marker.
         *
         * @return the logical payload bytes
         * @throws EscapeException if the stream ends before a bare marker, or
         *                         right after an escape byte; the index is
         *                         relative to the first byte of the payload
         * @throws ResourceLimitExceededException if the payload grows beyond the limit
         */
        public byte[] decode(InputStream in) throws IOException, EscapeException
        {
            consumed = 0;
            int len = 0;
            while (true) {
                int b = in.read();
                if (b < 0) {
                    throw new EscapeException("stream ended inside the payload", consumed);
                }
                consumed++;
                if (b == OtbmFraming.NODE_START || b == OtbmFraming.NODE_END) {
                    terminator = b;
                    break;
                }
                if (b == OtbmFraming.ESCAPE) {
                    b = in.read();
                    if (b < 0) {
                        throw new EscapeException("dangling escape byte at end of stream", consumed - 1);
                    }
                    consumed++;
                }
                if (len == maxPayload) {
                    throw new ResourceLimitExceededException("node payload bytes", maxPayload, len + 1L);
                }
                if (len == buffer.length) {
                    buffer = Arrays.copyOf(buffer, (int) Math.min((long) len * 2, maxPayload));
                }
                buffer[len++] = (byte) b;
            }
            return Arrays.copyOf(buffer, len);
        }

        /**
         * The bare marker that ended the last decoded payload.
         */
        public int terminator() {
            return terminator;
        }

        /**
         * Wire bytes taken by the last decode, its terminating marker included.
         */
        public int consumed() {
            return consumed;
        }
    }
}
