package com.questrail.tilemap.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * One keyed entry of an item's generic attribute map.
 *
 * <p>The value is kept as its raw little-endian bytes (without the length prefix
 * for strings) so that entries survive a load/save cycle exactly, whatever the
 * consuming server makes of them.</p>
 */
public final class AttributeMapEntry
{
    private final String key;
    private final AttributeValueType type;
    private final byte[] value;

    public AttributeMapEntry(String key, AttributeValueType type, byte[] value) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (type.fixedSize() >= 0 && value.length != type.fixedSize()) {
            throw new IllegalArgumentException(
                    type + " value must be " + type.fixedSize() + " bytes, got " + value.length);
        }
        this.value = value.clone();
    }

    public static AttributeMapEntry ofString(String key, String text) {
        return new AttributeMapEntry(key, AttributeValueType.STRING,
                Latin1.encode(text));
    }

    public static AttributeMapEntry ofInteger(String key, int number) {
        byte[] raw = {
                (byte) number, (byte) (number >>> 8), (byte) (number >>> 16), (byte) (number >>> 24)
        };
        return new AttributeMapEntry(key, AttributeValueType.INTEGER, raw);
    }

    public static AttributeMapEntry ofBoolean(String key, boolean flag) {
        return new AttributeMapEntry(key, AttributeValueType.BOOLEAN, new byte[] { (byte) (flag ? 1 : 0) });
    }

    public String key() {
        return key;
    }

    public AttributeValueType type() {
        return type;
    }

    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeMapEntry)) return false;
        AttributeMapEntry that = (AttributeMapEntry) o;
        return key.equals(that.key) && type == that.type && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(key, type) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "AttributeMapEntry{" + key + ":" + type + "[" + value.length + "]}";
    }
}
