package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.api.FileIdentifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of sniffing a file.
 *
 * @param identifier the identifier to keep for an OTBM file; for a mislabeled
 *                   file this is {@link FileIdentifier#OTBM}
 * @param mislabeled true when the first four bytes match no known identifier
 *                   but the content is a node tree
 */
public record MapFileDetection(MapFileKind kind, Optional<FileIdentifier> identifier, boolean mislabeled, String reason)
{
    public MapFileDetection {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(reason, "reason");
    }

    public static MapFileDetection unknown(String reason) {
        return new MapFileDetection(MapFileKind.UNKNOWN, Optional.empty(), false, reason);
    }
}
