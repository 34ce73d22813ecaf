package com.questrail.tilemap.storage.otbm.codec;

import com.questrail.tilemap.api.Position;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * PayloadReader
 * -----------------------------------------------------------------------------
 * Little-endian field reader over one unescaped node payload.
 *
 * <p>Strings are a u16 byte length followed by ISO-8859-1 bytes, so every byte
 * sequence read from a file maps to a string that writes back identically.</p>
 *
 * <p>Every read checks the remaining length first and raises
 * {@link TruncatedPayloadException} instead of reading past the end.</p>
 */
public final class PayloadReader
{
    private final ByteBuf buf;

    public PayloadReader(byte[] payload) {
        this.buf = Unpooled.wrappedBuffer(payload);
    }

    public int readableBytes() {
        return buf.readableBytes();
    }

    public boolean isReadable() {
        return buf.isReadable();
    }

    /**
     * Index of the next unread byte.
     */
    public int position() {
        return buf.readerIndex();
    }

    public int readU8() {
        require(1);
        return buf.readUnsignedByte();
    }

    public int readU16() {
        require(2);
        return buf.readUnsignedShortLE();
    }

    public int readI16() {
        require(2);
        return buf.readShortLE();
    }

    public long readU32() {
        require(4);
        return buf.readUnsignedIntLE();
    }

    public String readString() {
        int mark = buf.readerIndex();
        int length = readU16();
        if (buf.readableBytes() < length) {
            buf.readerIndex(mark);
            throw new TruncatedPayloadException(2 + length, buf.readableBytes());
        }
        return buf.readCharSequence(length, StandardCharsets.ISO_8859_1).toString();
    }

    public byte[] readBytes(int length) {
        require(length);
        byte[] out = new byte[length];
        buf.readBytes(out);
        return out;
    }

    public Position readPosition() {
        require(5);
        int x = buf.readUnsignedShortLE();
        int y = buf.readUnsignedShortLE();
        int z = buf.readUnsignedByte();
        return new Position(x, y, z);
    }

    /**
     * Returns the bytes from {@code from} to the payload end and consumes them.
     */
    public byte[] takeRemainderFrom(int from) {
        if (from < 0 || from > buf.writerIndex()) {
            throw new IndexOutOfBoundsException("from=" + from);
        }
        byte[] out = new byte[buf.writerIndex() - from];
        buf.getBytes(from, out);
        buf.readerIndex(buf.writerIndex());
        return out;
    }

    private void require(int n) {
        if (n < 0 || buf.readableBytes() < n) {
            throw new TruncatedPayloadException(n, buf.readableBytes());
        }
    }
}
