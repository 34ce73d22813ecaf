package com.questrail.tilemap.api;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict ISO-8859-1 encoding for the text fields of a map.
 *
 * <p>Map files store text as single bytes. A character outside Latin-1 has no
 * byte, so encoding fails instead of substituting {@code '?'}.</p>
 */
public final class Latin1
{
    private Latin1() {}

    public static boolean canEncode(CharSequence text) {
        return newEncoder().canEncode(text);
    }

    /**
     * @throws IllegalArgumentException if {@code text} holds a character outside Latin-1
     */
    public static byte[] encode(String text)
    {
        try {
            ByteBuffer encoded = newEncoder().encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        }
        catch (CharacterCodingException e) {
            throw new IllegalArgumentException("text cannot be stored as Latin-1: \"" + text + "\"", e);
        }
    }

    // Encoders are stateful; one per call.
    private static CharsetEncoder newEncoder() {
        return StandardCharsets.ISO_8859_1.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
