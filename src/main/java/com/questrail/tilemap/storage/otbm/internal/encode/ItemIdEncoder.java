package com.questrail.tilemap.storage.otbm.internal.encode;

import com.questrail.tilemap.api.IdSpace;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.UnresolvedItemId;
import com.questrail.tilemap.mapping.ItemIdTranslator;
import com.questrail.tilemap.storage.otbm.error.ItemDatabaseUnavailableException;
import com.questrail.tilemap.storage.otbm.format.FormatContext;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Chooses the id an in-memory item is written with.
 *
 * <ul>
 *   <li>An unresolved item is written with its original raw id, but only into
 *       the id space that id came from.</li>
 *   <li>ServerID targets take the id as is.</li>
 *   <li>ClientID targets translate through the item database.</li>
 * </ul>
 */
public final class ItemIdEncoder
{
    private final IdSpace target;
    private final ItemIdTranslator translator;

    private ItemIdEncoder(IdSpace target, ItemIdTranslator translator) {
        this.target = Objects.requireNonNull(target, "target");
        this.translator = translator;
    }

    /**
     * @throws ItemDatabaseUnavailableException for a ClientID target without an item database
     */
    public static ItemIdEncoder forTarget(FormatContext context) {
        IdSpace space = context.version().idSpace();
        return new ItemIdEncoder(space, space == IdSpace.CLIENT ? context.requireTranslator() : null);
    }

    public IdSpace target() {
        return target;
    }

    /**
     * The on-disk id of {@code item}, or empty when the target cannot represent it.
     */
    public OptionalInt encode(Item item)
    {
        Optional<UnresolvedItemId> unresolved = item.unresolvedId();
        if (unresolved.isPresent()) {
            UnresolvedItemId raw = unresolved.get();
            return raw.space() == target ? OptionalInt.of(raw.rawId()) : OptionalInt.empty();
        }
        if (target == IdSpace.SERVER) {
            return OptionalInt.of(item.id());
        }
        return translator.findClientId(item.id());
    }
}
