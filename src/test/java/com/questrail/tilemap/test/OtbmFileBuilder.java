package com.questrail.tilemap.test;

import com.questrail.tilemap.api.FileIdentifier;
import com.questrail.tilemap.storage.otbm.codec.PayloadWriter;
import com.questrail.tilemap.storage.otbm.codec.impl.DefaultOtbmNodeWriter;
import com.questrail.tilemap.storage.otbm.format.NodeKind;
import com.questrail.tilemap.storage.otbm.format.OtbmAttribute;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Builds map files node by node for tests.
 *
 * <p>Nodes are opened and closed explicitly; {@link #build()} closes whatever
 * is still open. Items default to the ServerID 100 ground used by most
 * tests.</p>
 */
public final class OtbmFileBuilder
{
    public static final long ITEMS_MAJOR = 3;
    public static final long ITEMS_MINOR = 57;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final DefaultOtbmNodeWriter writer = new DefaultOtbmNodeWriter(out);

    private OtbmFileBuilder(byte[] identifier) {
        out.writeBytes(identifier);
    }

    /**
     * A file with the "OTBM" identifier, the root node open.
     */
    public static OtbmFileBuilder map(long wireVersion, int width, int height) {
        return withIdentifier(FileIdentifier.OTBM.bytes(), wireVersion, width, height);
    }

    public static OtbmFileBuilder withIdentifier(byte[] identifier, long wireVersion, int width, int height) {
        OtbmFileBuilder b = new OtbmFileBuilder(identifier);
        return b.open(NodeKind.ROOT.type(), new PayloadWriter()
                .writeU32(wireVersion)
                .writeU16(width)
                .writeU16(height)
                .writeU32(ITEMS_MAJOR)
                .writeU32(ITEMS_MINOR)
                .toByteArray());
    }

    public OtbmFileBuilder open(int type, byte[] payload)
    {
        try {
            writer.startNode(type);
            writer.writePayload(payload);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public OtbmFileBuilder open(NodeKind kind, PayloadWriter payload) {
        return open(kind.type(), payload.toByteArray());
    }

    public OtbmFileBuilder close()
    {
        try {
            writer.endNode();
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public OtbmFileBuilder leaf(NodeKind kind, PayloadWriter payload) {
        return open(kind, payload).close();
    }

    // -------------------------------------------------------------------------
    // Shorthands
    // -------------------------------------------------------------------------

    public OtbmFileBuilder mapData() {
        return open(NodeKind.MAP_DATA, new PayloadWriter());
    }

    public OtbmFileBuilder mapData(String description) {
        return open(NodeKind.MAP_DATA, new PayloadWriter()
                .writeU8(OtbmAttribute.DESCRIPTION.tag())
                .writeString(description));
    }

    public OtbmFileBuilder tileArea(int baseX, int baseY, int z) {
        return open(NodeKind.TILE_AREA, new PayloadWriter().writeU16(baseX).writeU16(baseY).writeU8(z));
    }

    public OtbmFileBuilder tile(int offsetX, int offsetY) {
        return open(NodeKind.TILE, new PayloadWriter().writeU8(offsetX).writeU8(offsetY));
    }

    /**
     * A tile whose ground is stored in the tile payload.
     */
    public OtbmFileBuilder tileWithGround(int offsetX, int offsetY, int groundId) {
        return open(NodeKind.TILE, new PayloadWriter()
                .writeU8(offsetX)
                .writeU8(offsetY)
                .writeU8(OtbmAttribute.ITEM.tag())
                .writeU16(groundId));
    }

    public OtbmFileBuilder houseTile(int offsetX, int offsetY, long houseId) {
        return open(NodeKind.HOUSETILE, new PayloadWriter().writeU8(offsetX).writeU8(offsetY).writeU32(houseId));
    }

    public OtbmFileBuilder item(int id) {
        return leaf(NodeKind.ITEM, new PayloadWriter().writeU16(id));
    }

    public OtbmFileBuilder item(PayloadWriter payload) {
        return leaf(NodeKind.ITEM, payload);
    }

    public int depth() {
        return writer.depth();
    }

    public byte[] build()
    {
        while (writer.depth() > 0) {
            close();
        }
        return out.toByteArray();
    }

    // -------------------------------------------------------------------------
    // Ready-made files
    // -------------------------------------------------------------------------

    /**
     * ServerID map, version 3, with one tile at (0,0,7) whose ground is item 100.
     */
    public static byte[] singleGroundTile() {
        return map(2, 256, 256)
                .mapData()
                .tileArea(0, 0, 7)
                .tileWithGround(0, 0, 100)
                .build();
    }
}
