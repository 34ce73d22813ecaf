package com.questrail.tilemap.database;

import com.questrail.tilemap.mapping.ArrayItemIdTranslator;
import com.questrail.tilemap.mapping.ItemIdTranslator;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ItemDatabase
 * -----------------------------------------------------------------------------
 * Item types keyed by ServerID, with the id translator derived from them.
 *
 * <p>A database is immutable once built. It is meant to be loaded once per
 * session and shared by every load and save of that session.</p>
 */
public final class ItemDatabase
{
    private final ItemsOtbHeader header;
    private final Map<Integer, ItemType> types;
    private final ItemIdTranslator translator;
    private final int duplicateServerIds;

    private ItemDatabase(ItemsOtbHeader header, Map<Integer, ItemType> types, int duplicateServerIds) {
        this.header = header;
        this.types = Collections.unmodifiableMap(types);
        this.duplicateServerIds = duplicateServerIds;

        ArrayItemIdTranslator.Builder tb = ArrayItemIdTranslator.builder();
        types.values().stream()
                .filter(t -> t.clientId() > 0)
                .sorted((a, b) -> Integer.compare(a.serverId(), b.serverId()))
                .forEach(t -> tb.map(t.serverId(), t.clientId()));
        this.translator = tb.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ItemsOtbHeader> header() {
        return Optional.ofNullable(header);
    }

    /**
     * Client version of the database, or 0 when it carries no header.
     */
    public int clientVersion() {
        return header == null ? 0 : header.clientVersion();
    }

    public Optional<ItemType> find(int serverId) {
        return Optional.ofNullable(types.get(serverId));
    }

    public boolean contains(int serverId) {
        return types.containsKey(serverId);
    }

    public boolean isGround(int serverId) {
        ItemType t = types.get(serverId);
        return t != null && t.isGround();
    }

    public boolean hasInlineSubtype(int serverId) {
        ItemType t = types.get(serverId);
        return t != null && t.hasInlineSubtype();
    }

    public Collection<ItemType> types() {
        return types.values();
    }

    public int size() {
        return types.size();
    }

    /**
     * Entries dropped while building because their server id was already taken.
     */
    public int duplicateServerIds() {
        return duplicateServerIds;
    }

    public ItemIdTranslator translator() {
        return translator;
    }

    /**
     * A copy with names applied from auxiliary metadata. Ids without a type are ignored.
     */
    public ItemDatabase withNames(Map<Integer, String> names) {
        Map<Integer, ItemType> renamed = new HashMap<>(types);
        names.forEach((id, name) -> renamed.computeIfPresent(id, (k, t) -> t.withName(name)));
        return new ItemDatabase(header, renamed, duplicateServerIds);
    }

    public static final class Builder
    {
        private ItemsOtbHeader header;
        private final Map<Integer, ItemType> types = new HashMap<>();
        private int duplicates;

        public Builder withHeader(ItemsOtbHeader header) {
            this.header = header;
            return this;
        }

        /**
         * Adds a type; the first type registered for a server id wins.
         *
         * @return false if the server id was already present
         */
        public boolean add(ItemType type) {
            Objects.requireNonNull(type, "type");
            if (types.putIfAbsent(type.serverId(), type) != null) {
                duplicates++;
                return false;
            }
            return true;
        }

        public ItemDatabase build() {
            return new ItemDatabase(header, new HashMap<>(types), duplicates);
        }
    }
}
