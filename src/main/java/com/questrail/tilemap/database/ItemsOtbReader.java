package com.questrail.tilemap.database;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.codec.OtbmNodeReader;
import com.questrail.tilemap.storage.otbm.codec.PayloadReader;
import com.questrail.tilemap.storage.otbm.codec.TruncatedPayloadException;
import com.questrail.tilemap.storage.otbm.codec.impl.DefaultOtbmNodeReader;
import com.questrail.tilemap.storage.otbm.error.MapFormatException;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * ItemsOtbReader
 * -----------------------------------------------------------------------------
 * Reads an items.otb file into an {@link ItemDatabase}.
 *
 * <p>items.otb uses the same node-tree encoding as map files, so this reader
 * runs on {@link DefaultOtbmNodeReader}:</p>
 * <ul>
 *   <li>root payload: u32 flags, then the version attribute
 *       ({@code u8 0x01, u16 140, u32 major, u32 minor, u32 build, char[128] csd})</li>
 *   <li>one child per item: the node type is the item group, the payload is a
 *       u32 flag word followed by {@code [u8 attr][u16 len][len bytes]} blocks</li>
 * </ul>
 *
 * <p>Only the server id, client id, group and flags are kept. Items of the
 * deprecated group and items lacking either id are skipped.</p>
 */
public final class ItemsOtbReader
{
    static final byte[] MAGIC_OTBI = { 'O', 'T', 'B', 'I' };
    static final byte[] MAGIC_ZERO = { 0, 0, 0, 0 };

    static final int ROOT_ATTR_VERSION = 0x01;
    static final int VERSION_BLOCK_LENGTH = 4 + 4 + 4 + 128;
    static final int ATTR_SERVER_ID = 0x10;
    static final int ATTR_CLIENT_ID = 0x11;

    private static final int MAX_PAYLOAD = 1024 * 1024;
    private static final int MAX_DEPTH = 8;

    public ItemDatabase read(Path path) throws IOException, ItemDatabaseException
    {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path), 64 * 1024)) {
            return read(in, path.toString());
        }
    }

    public ItemDatabase read(InputStream in, String sourceName) throws IOException, ItemDatabaseException
    {
        byte[] magic = in.readNBytes(4);
        if (!Arrays.equals(magic, MAGIC_OTBI) && !Arrays.equals(magic, MAGIC_ZERO)) {
            throw new ItemDatabaseException(sourceName + ": not an items.otb file");
        }

        OtbmNodeReader reader = new DefaultOtbmNodeReader(in, 4, type -> "group" + type, MAX_PAYLOAD, MAX_DEPTH);
        ItemDatabase.Builder builder = ItemDatabase.builder();
        try {
            Optional<NodeEvent> event = reader.next();
            if (event.isEmpty() || !(event.get() instanceof NodeEvent.Start)) {
                throw new ItemDatabaseException(sourceName + ": missing root node");
            }
            builder.withHeader(parseHeader(((NodeEvent.Start) event.get()).payload(), sourceName));

            while ((event = reader.next()).isPresent()) {
                if (event.get() instanceof NodeEvent.Start) {
                    NodeEvent.Start start = (NodeEvent.Start) event.get();
                    if (start.depth() == 2) {
                        parseItem(start.type(), start.payload()).ifPresent(builder::add);
                    }
                }
            }
        }
        catch (MapFormatException e) {
            throw new ItemDatabaseException(sourceName + ": " + e.getMessage(), e);
        }
        return builder.build();
    }

    static ItemsOtbHeader parseHeader(byte[] rootPayload, String sourceName) throws ItemDatabaseException
    {
        PayloadReader p = new PayloadReader(rootPayload);
        try {
            p.readU32(); // flags, unused
            if (p.readU8() != ROOT_ATTR_VERSION) {
                throw new ItemDatabaseException(sourceName + ": expected version attribute first in root node");
            }
            if (p.readU16() != VERSION_BLOCK_LENGTH) {
                throw new ItemDatabaseException(sourceName + ": invalid version block size");
            }
            long major = p.readU32();
            long minor = p.readU32();
            long build = p.readU32();
            byte[] raw = p.readBytes(128);
            int end = 0;
            while (end < raw.length && raw[end] != 0) {
                end++;
            }
            return new ItemsOtbHeader(major, minor, build, new String(raw, 0, end, StandardCharsets.ISO_8859_1));
        }
        catch (TruncatedPayloadException e) {
            throw new ItemDatabaseException(sourceName + ": truncated root node", e);
        }
    }

    static Optional<ItemType> parseItem(int groupCode, byte[] payload)
    {
        ItemGroup group = ItemGroup.fromCode(groupCode);
        if (group == ItemGroup.DEPRECATED) {
            return Optional.empty();
        }

        PayloadReader p = new PayloadReader(payload);
        if (p.readableBytes() < 4) {
            return Optional.empty();
        }
        long flags = p.readU32();
        int serverId = -1;
        int clientId = -1;
        while (p.readableBytes() >= 3) {
            int attr = p.readU8();
            int length = p.readU16();
            if (p.readableBytes() < length) {
                break; // cut-off trailing attribute
            }
            byte[] data = p.readBytes(length);
            if (length == 2 && attr == ATTR_SERVER_ID) {
                serverId = (data[0] & 0xFF) | (data[1] & 0xFF) << 8;
            } else if (length == 2 && attr == ATTR_CLIENT_ID) {
                clientId = (data[0] & 0xFF) | (data[1] & 0xFF) << 8;
            }
        }

        if (serverId < 0 || clientId < 0) {
            return Optional.empty();
        }
        return Optional.of(new ItemType(serverId, clientId, group, flags, ""));
    }
}
