package com.questrail.tilemap.database;

import com.questrail.tilemap.storage.otbm.format.ItemDatabaseFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Builds an {@link ItemDatabase} from the files a format descriptor names.
 *
 * <p>Problems are reported to the caller's consumer and yield an empty result
 * (or a database without names) instead of an exception: whether a missing
 * database is fatal depends on the map being read.</p>
 */
public final class ItemDatabaseLoader
{
    private final ItemsOtbReader otbReader;
    private final ItemsXmlReader xmlReader;

    public ItemDatabaseLoader() {
        this(new ItemsOtbReader(), new ItemsXmlReader());
    }

    public ItemDatabaseLoader(ItemsOtbReader otbReader, ItemsXmlReader xmlReader) {
        this.otbReader = otbReader;
        this.xmlReader = xmlReader;
    }

    public Optional<ItemDatabase> load(ItemDatabaseFiles files, Consumer<String> problems)
    {
        if (files.itemsOtb().isEmpty()) {
            return Optional.empty();
        }

        Path otb = files.itemsOtb().get();
        ItemDatabase database;
        try {
            database = otbReader.read(otb);
        }
        catch (IOException | ItemDatabaseException e) {
            problems.accept("cannot read " + otb + ": " + e.getMessage());
            return Optional.empty();
        }

        if (files.itemsXml().isPresent() && Files.isRegularFile(files.itemsXml().get())) {
            Path xml = files.itemsXml().get();
            try {
                Map<Integer, String> names = xmlReader.readNames(xml);
                database = database.withNames(names);
            }
            catch (IOException | ItemDatabaseException e) {
                problems.accept("cannot read " + xml + ": " + e.getMessage());
            }
        }

        if (database.duplicateServerIds() > 0) {
            problems.accept(otb + ": " + database.duplicateServerIds() + " duplicate server id(s) ignored");
        }
        if (!database.translator().aliasServerIds().isEmpty()) {
            problems.accept(otb + ": " + database.translator().aliasServerIds().size()
                    + " server id(s) share a client id with an earlier entry");
        }
        return Optional.of(database);
    }
}
