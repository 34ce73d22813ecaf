package com.questrail.tilemap.test;

import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.database.ItemGroup;
import com.questrail.tilemap.database.ItemType;
import com.questrail.tilemap.database.ItemsOtbHeader;
import com.questrail.tilemap.storage.otbm.codec.PayloadWriter;
import com.questrail.tilemap.storage.otbm.codec.impl.DefaultOtbmNodeWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds items.otb files and the matching in-memory databases for tests.
 */
public final class ItemsOtbBuilder
{
    private final String csd;
    private final List<ItemType> types = new ArrayList<>();

    private ItemsOtbBuilder(String csd) {
        this.csd = csd;
    }

    public static ItemsOtbBuilder withDescription(String csd) {
        return new ItemsOtbBuilder(csd);
    }

    /**
     * The database most tests share, built for client 13.10.
     *
     * <ul>
     *   <li>100, 101: grounds (client 5000, 5001)</li>
     *   <li>1987: container (client 2854)</li>
     *   <li>2148: stackable coins (client 3031)</li>
     *   <li>2016: splash (client 2886)</li>
     *   <li>1387: teleport (client 1949)</li>
     *   <li>3000, 3001: both client 3500, 3001 is an alias</li>
     *   <li>4000: no client id</li>
     * </ul>
     */
    public static ItemsOtbBuilder standard() {
        return withDescription("OTB 3.65.62-13.10")
                .add(ItemGroup.GROUND, 0, 100, 5000)
                .add(ItemGroup.GROUND, 0, 101, 5001)
                .add(ItemGroup.CONTAINER, 0, 1987, 2854)
                .add(ItemGroup.NONE, ItemType.FLAG_STACKABLE, 2148, 3031)
                .add(ItemGroup.SPLASH, 0, 2016, 2886)
                .add(ItemGroup.TELEPORT, 0, 1387, 1949)
                .add(ItemGroup.NONE, 0, 3000, 3500)
                .add(ItemGroup.NONE, 0, 3001, 3500)
                .add(ItemGroup.NONE, 0, 4000, 0);
    }

    public static ItemDatabase standardDatabase() {
        return standard().database();
    }

    public ItemsOtbBuilder add(ItemGroup group, long flags, int serverId, int clientId) {
        types.add(new ItemType(serverId, clientId, group, flags, ""));
        return this;
    }

    /**
     * The database the reader is expected to produce from {@link #build()}.
     */
    public ItemDatabase database()
    {
        ItemDatabase.Builder builder = ItemDatabase.builder().withHeader(new ItemsOtbHeader(3, 65, 62, csd));
        for (ItemType type : types) {
            if (type.group() != ItemGroup.DEPRECATED) {
                builder.add(type);
            }
        }
        return builder.build();
    }

    public byte[] build()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[] { 'O', 'T', 'B', 'I' });
        DefaultOtbmNodeWriter writer = new DefaultOtbmNodeWriter(out);

        byte[] description = new byte[128];
        byte[] text = csd.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(text, 0, description, 0, Math.min(text.length, 127));

        try {
            writer.startNode(0);
            writer.writePayload(new PayloadWriter()
                    .writeU32(0)
                    .writeU8(0x01)
                    .writeU16(140)
                    .writeU32(3)
                    .writeU32(65)
                    .writeU32(62)
                    .writeBytes(description)
                    .toByteArray());
            for (ItemType type : types) {
                writer.startNode(type.group().ordinal());
                writer.writePayload(new PayloadWriter()
                        .writeU32(type.flags())
                        .writeU8(0x10).writeU16(2).writeU16(type.serverId())
                        .writeU8(0x11).writeU16(2).writeU16(type.clientId())
                        .toByteArray());
                writer.endNode();
            }
            writer.endNode();
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public Path writeTo(Path file) throws IOException {
        return Files.write(file, build());
    }
}
