package com.questrail.tilemap.storage.otbm.format;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locations of the item database files a format should be read with.
 */
public record ItemDatabaseFiles(Optional<Path> itemsOtb, Optional<Path> itemsXml)
{
    public static final ItemDatabaseFiles NONE = new ItemDatabaseFiles(Optional.empty(), Optional.empty());

    public ItemDatabaseFiles {
        Objects.requireNonNull(itemsOtb, "itemsOtb");
        Objects.requireNonNull(itemsXml, "itemsXml");
    }

    public boolean isEmpty() {
        return itemsOtb.isEmpty() && itemsXml.isEmpty();
    }
}
