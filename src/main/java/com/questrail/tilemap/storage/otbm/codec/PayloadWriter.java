package com.questrail.tilemap.storage.otbm.codec;

import com.questrail.tilemap.api.Latin1;
import com.questrail.tilemap.api.Position;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * Little-endian field writer that builds one node payload.
 *
 * <p>Values that do not fit their field width are rejected with
 * {@link IllegalArgumentException}. A writer can be {@link #reset()} and reused
 * for the next node.</p>
 */
public final class PayloadWriter
{
    private final ByteBuf buf = Unpooled.buffer(64);

    public PayloadWriter writeU8(int value) {
        checkUnsigned("u8", value, 0xFF);
        buf.writeByte(value);
        return this;
    }

    public PayloadWriter writeU16(int value) {
        checkUnsigned("u16", value, 0xFFFF);
        buf.writeShortLE(value);
        return this;
    }

    public PayloadWriter writeI16(int value) {
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
            throw new IllegalArgumentException("i16 out of range: " + value);
        }
        buf.writeShortLE(value);
        return this;
    }

    public PayloadWriter writeU32(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("u32 out of range: " + value);
        }
        buf.writeIntLE((int) value);
        return this;
    }

    /**
     * Writes a u16 length followed by the Latin-1 bytes of {@code value}.
     *
     * @throws IllegalArgumentException if the text is too long or not Latin-1
     */
    public PayloadWriter writeString(String value) {
        byte[] bytes = Latin1.encode(value);
        if (bytes.length > 0xFFFF) {
            throw new IllegalArgumentException("string longer than 65535 bytes");
        }
        buf.writeShortLE(bytes.length);
        buf.writeBytes(bytes);
        return this;
    }

    public PayloadWriter writeBytes(byte[] bytes) {
        buf.writeBytes(bytes);
        return this;
    }

    public PayloadWriter writePosition(Position position) {
        buf.writeShortLE(position.x());
        buf.writeShortLE(position.y());
        buf.writeByte(position.z());
        return this;
    }

    /**
     * Drops everything written after the first {@code size} bytes.
     */
    public PayloadWriter truncate(int size) {
        if (size < 0 || size > buf.writerIndex()) {
            throw new IndexOutOfBoundsException("truncate to " + size + " of " + buf.writerIndex());
        }
        buf.writerIndex(size);
        return this;
    }

    public int size() {
        return buf.readableBytes();
    }

    public byte[] toByteArray() {
        return ByteBufUtil.getBytes(buf);
    }

    public PayloadWriter reset() {
        buf.clear();
        return this;
    }

    private static void checkUnsigned(String width, int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(width + " out of range: " + value);
        }
    }
}
