package com.questrail.tilemap.database;

/**
 * Item groups as numbered in items.otb.
 */
public enum ItemGroup
{
    NONE,
    GROUND,
    CONTAINER,
    WEAPON,
    AMMUNITION,
    ARMOR,
    CHARGES,
    TELEPORT,
    MAGIC_FIELD,
    WRITEABLE,
    KEY,
    SPLASH,
    FLUID,
    DEPRECATED;

    public static ItemGroup fromCode(int code) {
        ItemGroup[] all = values();
        return code >= 0 && code < all.length ? all[code] : NONE;
    }
}
