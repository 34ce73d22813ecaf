package com.questrail.tilemap.storage.otbm.format;

import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.mapping.ItemIdTranslator;
import com.questrail.tilemap.storage.otbm.error.ItemDatabaseUnavailableException;

import java.util.Objects;
import java.util.Optional;

/**
 * FormatContext
 * -----------------------------------------------------------------------------
 * Everything a load or save needs to know about the on-disk format: the
 * descriptor and, when one was available, the item database.
 *
 * <p>The context is an explicit value passed to each operation. A load returns
 * the context it used so the host can hand it to the matching save, and can
 * reuse its item database for the rest of the session.</p>
 */
public final class FormatContext
{
    private final FormatDescriptor descriptor;
    private final ItemDatabase itemDatabase;

    private FormatContext(FormatDescriptor descriptor, ItemDatabase itemDatabase) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.itemDatabase = itemDatabase;
    }

    public static FormatContext of(FormatDescriptor descriptor, Optional<ItemDatabase> itemDatabase) {
        return new FormatContext(descriptor, itemDatabase.orElse(null));
    }

    public static FormatContext of(FormatDescriptor descriptor, ItemDatabase itemDatabase) {
        return new FormatContext(descriptor, Objects.requireNonNull(itemDatabase, "itemDatabase"));
    }

    public static FormatContext withoutDatabase(FormatDescriptor descriptor) {
        return new FormatContext(descriptor, null);
    }

    public FormatDescriptor descriptor() {
        return descriptor;
    }

    public OtbmVersion version() {
        return descriptor.version();
    }

    public Optional<ItemDatabase> itemDatabase() {
        return Optional.ofNullable(itemDatabase);
    }

    /**
     * The same database under a different descriptor, e.g. a conversion target.
     */
    public FormatContext withDescriptor(FormatDescriptor newDescriptor) {
        return new FormatContext(newDescriptor, itemDatabase);
    }

    /**
     * Translator of the item database.
     *
     * @throws ItemDatabaseUnavailableException when no database is present
     */
    public ItemIdTranslator requireTranslator() {
        if (itemDatabase == null) {
            throw new ItemDatabaseUnavailableException(
                    "map version " + descriptor.version() + " stores client ids but no item database is available");
        }
        return itemDatabase.translator();
    }

    @Override
    public String toString() {
        return "FormatContext{" + descriptor.version()
                + ", clientVersion=" + descriptor.clientVersion()
                + ", itemDatabase=" + (itemDatabase == null ? "none" : itemDatabase.size() + " types")
                + '}';
    }
}
