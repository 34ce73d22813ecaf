package com.questrail.tilemap.api;

import java.util.Optional;

/**
 * Value types of a keyed item attribute-map entry, with their wire tags.
 */
public enum AttributeValueType
{
    NONE(0, 0),
    STRING(1, -1),
    INTEGER(2, 4),
    FLOAT(3, 4),
    BOOLEAN(4, 1),
    DOUBLE(5, 8);

    private final int tag;
    private final int fixedSize;

    AttributeValueType(int tag, int fixedSize) {
        this.tag = tag;
        this.fixedSize = fixedSize;
    }

    public int tag() {
        return tag;
    }

    /**
     * Size in bytes of the value, or -1 when the value is length-prefixed.
     */
    public int fixedSize() {
        return fixedSize;
    }

    public static Optional<AttributeValueType> fromTag(int tag) {
        for (AttributeValueType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
