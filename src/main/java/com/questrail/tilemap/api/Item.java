package com.questrail.tilemap.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Item
 * -----------------------------------------------------------------------------
 * An immutable item instance placed on a tile or inside a container.
 *
 * <p>The {@link #id()} is always a ServerID. Optional attributes are absent
 * unless they were present in the source file or set by the host. Numeric
 * attributes are range-checked against their on-disk width when the item is
 * built, so every item held in memory can be written back.</p>
 *
 * <h2>Preserved data</h2>
 * <ul>
 *   <li>{@link #attributeMap()} keeps keyed attribute entries as raw typed bytes.</li>
 *   <li>{@link #opaqueRemainder()} keeps attribute bytes that followed an
 *       unrecognised tag; they are re-emitted verbatim after the known attributes.</li>
 *   <li>{@link #unresolvedId()} marks an item whose on-disk id could not be
 *       translated; the item then carries the placeholder id.</li>
 * </ul>
 */
public final class Item
{
    private static final byte[] NO_BYTES = new byte[0];

    private final int id;
    private final Integer count;
    private final Integer charges;
    private final Integer actionId;
    private final Integer uniqueId;
    private final String text;
    private final String description;
    private final Position teleportDestination;
    private final Integer depotId;
    private final Integer houseDoorId;
    private final Long duration;
    private final Integer decayingState;
    private final Long writtenDate;
    private final String writtenBy;
    private final Long sleeperGuid;
    private final Long sleepStart;
    private final Integer tier;
    private final List<AttributeMapEntry> attributeMap;
    private final List<Item> contents;
    private final byte[] opaqueRemainder;
    private final UnresolvedItemId unresolvedId;

    private Item(Builder b) {
        this.id = checkRange("id", b.id, 0xFFFF);
        this.count = checkRange("count", b.count, 0xFF);
        this.charges = checkRange("charges", b.charges, 0xFFFF);
        this.actionId = checkRange("actionId", b.actionId, 0xFFFF);
        this.uniqueId = checkRange("uniqueId", b.uniqueId, 0xFFFF);
        this.text = b.text;
        this.description = b.description;
        this.teleportDestination = b.teleportDestination;
        this.depotId = checkRange("depotId", b.depotId, 0xFFFF);
        this.houseDoorId = checkRange("houseDoorId", b.houseDoorId, 0xFF);
        this.duration = checkRange("duration", b.duration);
        this.decayingState = checkRange("decayingState", b.decayingState, 0xFF);
        this.writtenDate = checkRange("writtenDate", b.writtenDate);
        this.writtenBy = b.writtenBy;
        this.sleeperGuid = checkRange("sleeperGuid", b.sleeperGuid);
        this.sleepStart = checkRange("sleepStart", b.sleepStart);
        this.tier = checkRange("tier", b.tier, 0xFF);
        this.attributeMap = List.copyOf(b.attributeMap);
        this.contents = List.copyOf(b.contents);
        this.opaqueRemainder = b.opaqueRemainder.length == 0 ? NO_BYTES : b.opaqueRemainder.clone();
        this.unresolvedId = b.unresolvedId;
    }

    private static Integer checkRange(String name, Integer value, int max) {
        if (value != null && (value < 0 || value > max)) {
            throw new IllegalArgumentException(name + " out of range 0.." + max + ": " + value);
        }
        return value;
    }

    private static Long checkRange(String name, Long value) {
        if (value != null && (value < 0 || value > 0xFFFF_FFFFL)) {
            throw new IllegalArgumentException(name + " out of unsigned 32-bit range: " + value);
        }
        return value;
    }

    public static Item of(int id) {
        return builder(id).build();
    }

    public static Builder builder(int id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public int id() {
        return id;
    }

    public OptionalInt count() {
        return optional(count);
    }

    public OptionalInt charges() {
        return optional(charges);
    }

    public OptionalInt actionId() {
        return optional(actionId);
    }

    public OptionalInt uniqueId() {
        return optional(uniqueId);
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<Position> teleportDestination() {
        return Optional.ofNullable(teleportDestination);
    }

    public OptionalInt depotId() {
        return optional(depotId);
    }

    public OptionalInt houseDoorId() {
        return optional(houseDoorId);
    }

    public OptionalLong duration() {
        return optional(duration);
    }

    public OptionalInt decayingState() {
        return optional(decayingState);
    }

    public OptionalLong writtenDate() {
        return optional(writtenDate);
    }

    public Optional<String> writtenBy() {
        return Optional.ofNullable(writtenBy);
    }

    public OptionalLong sleeperGuid() {
        return optional(sleeperGuid);
    }

    public OptionalLong sleepStart() {
        return optional(sleepStart);
    }

    public OptionalInt tier() {
        return optional(tier);
    }

    public List<AttributeMapEntry> attributeMap() {
        return attributeMap;
    }

    public List<Item> contents() {
        return contents;
    }

    public byte[] opaqueRemainder() {
        return opaqueRemainder.length == 0 ? NO_BYTES : opaqueRemainder.clone();
    }

    public boolean hasOpaqueRemainder() {
        return opaqueRemainder.length > 0;
    }

    public Optional<UnresolvedItemId> unresolvedId() {
        return Optional.ofNullable(unresolvedId);
    }

    /**
     * True when nothing but the id would be written, which is what allows a
     * ground item to use the compact tile-payload form. An unresolved item
     * can be plain: its raw id is what gets written.
     */
    public boolean isPlain() {
        return count == null && charges == null && actionId == null && uniqueId == null
                && text == null && description == null && teleportDestination == null
                && depotId == null && houseDoorId == null && duration == null
                && decayingState == null && writtenDate == null && writtenBy == null
                && sleeperGuid == null && sleepStart == null && tier == null
                && attributeMap.isEmpty() && contents.isEmpty()
                && opaqueRemainder.length == 0;
    }

    /**
     * Number of items in this item's subtree, the item itself included.
     */
    public int subtreeSize() {
        int n = 1;
        for (Item child : contents) {
            n += child.subtreeSize();
        }
        return n;
    }

    private static OptionalInt optional(Integer value) {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    private static OptionalLong optional(Long value) {
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        Item that = (Item) o;
        return id == that.id
                && Objects.equals(count, that.count)
                && Objects.equals(charges, that.charges)
                && Objects.equals(actionId, that.actionId)
                && Objects.equals(uniqueId, that.uniqueId)
                && Objects.equals(text, that.text)
                && Objects.equals(description, that.description)
                && Objects.equals(teleportDestination, that.teleportDestination)
                && Objects.equals(depotId, that.depotId)
                && Objects.equals(houseDoorId, that.houseDoorId)
                && Objects.equals(duration, that.duration)
                && Objects.equals(decayingState, that.decayingState)
                && Objects.equals(writtenDate, that.writtenDate)
                && Objects.equals(writtenBy, that.writtenBy)
                && Objects.equals(sleeperGuid, that.sleeperGuid)
                && Objects.equals(sleepStart, that.sleepStart)
                && Objects.equals(tier, that.tier)
                && attributeMap.equals(that.attributeMap)
                && contents.equals(that.contents)
                && Arrays.equals(opaqueRemainder, that.opaqueRemainder)
                && Objects.equals(unresolvedId, that.unresolvedId);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(id, count, charges, actionId, uniqueId, text, description,
                teleportDestination, depotId, houseDoorId, duration, decayingState, writtenDate,
                writtenBy, sleeperGuid, sleepStart, tier, attributeMap, contents, unresolvedId);
        return 31 * h + Arrays.hashCode(opaqueRemainder);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Item{id=").append(id);
        if (count != null) sb.append(", count=").append(count);
        if (charges != null) sb.append(", charges=").append(charges);
        if (actionId != null) sb.append(", aid=").append(actionId);
        if (uniqueId != null) sb.append(", uid=").append(uniqueId);
        if (!contents.isEmpty()) sb.append(", contents=").append(contents.size());
        if (unresolvedId != null) sb.append(", unresolved=").append(unresolvedId);
        return sb.append('}').toString();
    }

    public static final class Builder
    {
        private int id;
        private Integer count;
        private Integer charges;
        private Integer actionId;
        private Integer uniqueId;
        private String text;
        private String description;
        private Position teleportDestination;
        private Integer depotId;
        private Integer houseDoorId;
        private Long duration;
        private Integer decayingState;
        private Long writtenDate;
        private String writtenBy;
        private Long sleeperGuid;
        private Long sleepStart;
        private Integer tier;
        private final List<AttributeMapEntry> attributeMap = new ArrayList<>();
        private final List<Item> contents = new ArrayList<>();
        private byte[] opaqueRemainder = NO_BYTES;
        private UnresolvedItemId unresolvedId;

        private Builder(int id) {
            this.id = id;
        }

        private Builder(Item item) {
            this.id = item.id;
            this.count = item.count;
            this.charges = item.charges;
            this.actionId = item.actionId;
            this.uniqueId = item.uniqueId;
            this.text = item.text;
            this.description = item.description;
            this.teleportDestination = item.teleportDestination;
            this.depotId = item.depotId;
            this.houseDoorId = item.houseDoorId;
            this.duration = item.duration;
            this.decayingState = item.decayingState;
            this.writtenDate = item.writtenDate;
            this.writtenBy = item.writtenBy;
            this.sleeperGuid = item.sleeperGuid;
            this.sleepStart = item.sleepStart;
            this.tier = item.tier;
            this.attributeMap.addAll(item.attributeMap);
            this.contents.addAll(item.contents);
            this.opaqueRemainder = item.opaqueRemainder;
            this.unresolvedId = item.unresolvedId;
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder count(Integer count) {
            this.count = count;
            return this;
        }

        public Builder charges(Integer charges) {
            this.charges = charges;
            return this;
        }

        public Builder actionId(Integer actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder uniqueId(Integer uniqueId) {
            this.uniqueId = uniqueId;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder teleportDestination(Position destination) {
            this.teleportDestination = destination;
            return this;
        }

        public Builder depotId(Integer depotId) {
            this.depotId = depotId;
            return this;
        }

        public Builder houseDoorId(Integer houseDoorId) {
            this.houseDoorId = houseDoorId;
            return this;
        }

        public Builder duration(Long duration) {
            this.duration = duration;
            return this;
        }

        public Builder decayingState(Integer decayingState) {
            this.decayingState = decayingState;
            return this;
        }

        public Builder writtenDate(Long writtenDate) {
            this.writtenDate = writtenDate;
            return this;
        }

        public Builder writtenBy(String writtenBy) {
            this.writtenBy = writtenBy;
            return this;
        }

        public Builder sleeperGuid(Long sleeperGuid) {
            this.sleeperGuid = sleeperGuid;
            return this;
        }

        public Builder sleepStart(Long sleepStart) {
            this.sleepStart = sleepStart;
            return this;
        }

        public Builder tier(Integer tier) {
            this.tier = tier;
            return this;
        }

        public Builder addAttribute(AttributeMapEntry entry) {
            this.attributeMap.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder addContent(Item item) {
            this.contents.add(Objects.requireNonNull(item, "item"));
            return this;
        }

        public Builder clearContents() {
            this.contents.clear();
            return this;
        }

        public Builder opaqueRemainder(byte[] remainder) {
            this.opaqueRemainder = remainder == null ? NO_BYTES : remainder.clone();
            return this;
        }

        public Builder unresolvedId(UnresolvedItemId unresolvedId) {
            this.unresolvedId = unresolvedId;
            return this;
        }

        public Item build() {
            return new Item(this);
        }
    }
}
