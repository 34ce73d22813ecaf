package com.questrail.tilemap.database;

import java.util.Objects;

/**
 * One entry of the item database.
 *
 * @param clientId the client sprite id, or 0 when the entry has none
 * @param flags    raw items.otb flag word
 */
public record ItemType(int serverId, int clientId, ItemGroup group, long flags, String name)
{
    public static final long FLAG_STACKABLE = 1L << 7;

    public ItemType {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(name, "name");
    }

    public boolean isGround() {
        return group == ItemGroup.GROUND;
    }

    public boolean isContainer() {
        return group == ItemGroup.CONTAINER;
    }

    public boolean isStackable() {
        return (flags & FLAG_STACKABLE) != 0;
    }

    /**
     * True when the oldest map version stores this item's count or charges as
     * a bare byte after its id.
     */
    public boolean hasInlineSubtype() {
        return isStackable() || group == ItemGroup.SPLASH || group == ItemGroup.FLUID;
    }

    public ItemType withName(String newName) {
        return new ItemType(serverId, clientId, group, flags, newName);
    }
}
