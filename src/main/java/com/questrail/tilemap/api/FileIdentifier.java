package com.questrail.tilemap.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four-byte identifier at the start of a map file.
 *
 * <p>Both forms are accepted on load; the one that was read is kept on the
 * header and written back on save.</p>
 */
public enum FileIdentifier
{
    OTBM(new byte[] { 'O', 'T', 'B', 'M' }),
    ZERO(new byte[] { 0, 0, 0, 0 });

    public static final int LENGTH = 4;

    private final byte[] bytes;

    FileIdentifier(byte[] bytes) {
        this.bytes = bytes;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public static Optional<FileIdentifier> match(byte[] candidate) {
        for (FileIdentifier id : values()) {
            if (Arrays.equals(id.bytes, candidate)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
