package com.questrail.tilemap.storage.otbm.format;

import java.util.Optional;

/**
 * Attribute tags used inside map-data, tile and item payloads.
 */
public enum OtbmAttribute
{
    DESCRIPTION(1),
    TILE_FLAGS(3),
    ACTION_ID(4),
    UNIQUE_ID(5),
    TEXT(6),
    DESC(7),
    TELE_DEST(8),
    ITEM(9),
    DEPOT_ID(10),
    EXT_SPAWN_FILE(11),
    RUNE_CHARGES(12),
    EXT_HOUSE_FILE(13),
    HOUSEDOORID(14),
    COUNT(15),
    DURATION(16),
    DECAYING_STATE(17),
    WRITTENDATE(18),
    WRITTENBY(19),
    SLEEPERGUID(20),
    SLEEPSTART(21),
    CHARGES(22),
    EXT_SPAWN_NPC_FILE(23),
    EXT_ZONE_FILE(24),
    TIER(41),
    ATTRIBUTE_MAP(128);

    private static final OtbmAttribute[] BY_TAG = new OtbmAttribute[256];

    static {
        for (OtbmAttribute a : values()) {
            BY_TAG[a.tag] = a;
        }
    }

    private final int tag;

    OtbmAttribute(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public static Optional<OtbmAttribute> fromTag(int tag) {
        return Optional.ofNullable(BY_TAG[tag & 0xFF]);
    }
}
