package com.questrail.tilemap.storage.otbm.format;

import java.util.Objects;

/**
 * FormatDescriptor
 * -----------------------------------------------------------------------------
 * The resolved shape of a map file: structural version, id space, the client
 * version it targets (0 when unknown), and the item database files that go
 * with it.
 */
public record FormatDescriptor(
        OtbmVersion version,
        boolean usesClientId,
        int clientVersion,
        ItemDatabaseFiles databaseFiles,
        ResolutionSource source
) {
    public FormatDescriptor {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(databaseFiles, "databaseFiles");
        Objects.requireNonNull(source, "source");
        if (usesClientId != version.usesClientId()) {
            throw new IllegalArgumentException(version + " does not use " + (usesClientId ? "client" : "server") + " ids");
        }
        if (clientVersion < 0) {
            throw new IllegalArgumentException("clientVersion must not be negative");
        }
    }

    public static FormatDescriptor of(OtbmVersion version) {
        return new FormatDescriptor(version, version.usesClientId(), 0, ItemDatabaseFiles.NONE, ResolutionSource.EXPLICIT);
    }

    public FormatDescriptor withVersion(OtbmVersion newVersion) {
        return new FormatDescriptor(newVersion, newVersion.usesClientId(), clientVersion, databaseFiles, source);
    }
}
