package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.api.FileIdentifier;
import com.questrail.tilemap.storage.otbm.codec.impl.OtbmFraming;
import com.questrail.tilemap.storage.otbm.format.NodeKind;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * MapFileSniffer
 * -----------------------------------------------------------------------------
 * Decides what a file is from its first bytes rather than its name.
 *
 * <p>A map file starts with a four-byte identifier followed by the root
 * node-start marker and a root type of 0 or 1. When the identifier is
 * unrecognised but the next two bytes still look like a root node, the file is
 * accepted as a mislabeled map. A file whose first non-blank character is
 * {@code '{'} is taken as a project file.</p>
 */
public final class MapFileSniffer
{
    public static final int HEAD_LENGTH = FileIdentifier.LENGTH + 2;

    public MapFileDetection detect(Path path) throws IOException
    {
        byte[] head;
        try (InputStream in = Files.newInputStream(path)) {
            head = in.readNBytes(64);
        }
        return detect(head);
    }

    public MapFileDetection detect(byte[] head)
    {
        if (looksLikeJson(head)) {
            return new MapFileDetection(MapFileKind.PROJECT_JSON, Optional.empty(), false, "JSON object");
        }
        if (head.length < HEAD_LENGTH) {
            return MapFileDetection.unknown("file too short (" + head.length + " bytes)");
        }

        Optional<FileIdentifier> identifier = FileIdentifier.match(Arrays.copyOf(head, FileIdentifier.LENGTH));
        boolean rootFollows = (head[4] & 0xFF) == OtbmFraming.NODE_START && NodeKind.isRootType(head[5] & 0xFF);

        if (identifier.isPresent() && rootFollows) {
            return new MapFileDetection(MapFileKind.OTBM, identifier, false, "identifier " + identifier.get());
        }
        if (identifier.isPresent()) {
            return MapFileDetection.unknown("identifier " + identifier.get() + " without a root node");
        }
        if (rootFollows) {
            return new MapFileDetection(MapFileKind.OTBM, Optional.of(FileIdentifier.OTBM), true,
                    "unrecognised identifier, root node present");
        }
        return MapFileDetection.unknown("no map identifier");
    }

    private static boolean looksLikeJson(byte[] head)
    {
        for (byte b : head) {
            if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                continue;
            }
            return b == '{';
        }
        return false;
    }
}
