package com.questrail.tilemap.tools;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Tile;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.mapping.ItemIdTranslator;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.LoadResult;
import com.questrail.tilemap.storage.otbm.report.SaveReport;
import com.questrail.tilemap.storage.otbm.runtime.OtbmMapStorage;
import com.questrail.tilemap.storage.otbm.version.WorkspaceContext;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * MapFormatConverter
 * -----------------------------------------------------------------------------
 * Migrates a map file between structural versions, including between the
 * ServerID and ClientID id spaces.
 *
 * <p>A conversion is a load with the source's own context followed by a save
 * with the same item database under the target version. The id translation
 * happens in the storage engine; the converter adds nothing to it.
 * {@link #analyze} predicts, without writing, whether a target can hold every
 * item.</p>
 */
public final class MapFormatConverter
{
    private final OtbmMapStorage storage;

    public MapFormatConverter(OtbmMapStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    public ConversionResult convert(Path source, WorkspaceContext workspace, Path destination, OtbmVersion target)
    {
        LoadResult loaded = storage.load(source, workspace);
        if (!loaded.success()) {
            return new ConversionResult(loaded.report(), Optional.empty());
        }
        FormatContext sourceContext = loaded.context().orElseThrow();
        FormatContext targetContext = sourceContext.withDescriptor(sourceContext.descriptor().withVersion(target));
        SaveReport saved = storage.save(loaded.map().orElseThrow(), destination, targetContext);
        return new ConversionResult(loaded.report(), Optional.of(saved));
    }

    public static ConversionAnalysis analyze(GameMap map, OtbmVersion target, FormatContext context)
    {
        Optional<ItemIdTranslator> translator = context.itemDatabase().map(ItemDatabase::translator);
        if (target.usesClientId() && translator.isEmpty()) {
            return new ConversionAnalysis(target, 0, 0, 0, List.of(), true);
        }

        long total = 0;
        long placeholders = 0;
        long stranded = 0;
        SortedSet<Integer> missing = new TreeSet<>();
        Deque<Item> pending = new ArrayDeque<>();
        for (Tile tile : map.tiles()) {
            tile.ground().ifPresent(pending::push);
            tile.items().forEach(pending::push);
            while (!pending.isEmpty()) {
                Item item = pending.pop();
                total++;
                if (item.unresolvedId().isPresent()) {
                    placeholders++;
                    if (item.unresolvedId().get().space() != target.idSpace()) {
                        stranded++;
                    }
                } else if (target.usesClientId() && !translator.get().hasServerId(item.id())) {
                    missing.add(item.id());
                }
                item.contents().forEach(pending::push);
            }
        }
        return new ConversionAnalysis(target, total, placeholders, stranded, List.copyOf(missing), false);
    }
}
