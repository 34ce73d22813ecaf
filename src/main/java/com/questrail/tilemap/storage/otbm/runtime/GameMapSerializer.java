package com.questrail.tilemap.storage.otbm.runtime;

import com.questrail.tilemap.api.GameMap;
import com.questrail.tilemap.storage.otbm.codec.impl.DefaultOtbmNodeWriter;
import com.questrail.tilemap.storage.otbm.error.InvalidMapDataException;
import com.questrail.tilemap.storage.otbm.format.FormatContext;
import com.questrail.tilemap.storage.otbm.internal.encode.GameMapEncoder;
import com.questrail.tilemap.storage.otbm.internal.encode.ItemIdEncoder;
import com.questrail.tilemap.storage.otbm.internal.encode.SavePreflight;
import com.questrail.tilemap.storage.otbm.report.IssueCollector;
import com.questrail.tilemap.storage.otbm.report.SaveStatistics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * GameMapSerializer
 * -----------------------------------------------------------------------------
 * Writes a {@link GameMap} in the format a {@link FormatContext} names.
 *
 * <p>Every save runs the pre-flight check first, so a map that cannot be
 * represented fails before the destination is opened. Values that only turn
 * out to be out of range while encoding (an over-long string, a tile outside
 * the coordinate space) surface as {@link InvalidMapDataException}; with a
 * file destination the existing file is then left untouched.</p>
 */
public final class GameMapSerializer
{
    private final AtomicFileWriter files;

    public GameMapSerializer() {
        this(new AtomicFileWriter());
    }

    public GameMapSerializer(AtomicFileWriter files) {
        this.files = Objects.requireNonNull(files, "files");
    }

    public SaveStatistics save(GameMap map, Path destination, FormatContext context, IssueCollector issues)
            throws IOException
    {
        GameMapEncoder encoder = prepare(map, context, issues);
        return files.write(destination, out -> encode(map, encoder, out));
    }

    /**
     * Writes to a caller-owned stream, which is flushed but not closed.
     */
    public SaveStatistics write(GameMap map, OutputStream out, FormatContext context, IssueCollector issues)
            throws IOException
    {
        GameMapEncoder encoder = prepare(map, context, issues);
        SaveStatistics statistics = encode(map, encoder, out);
        out.flush();
        return statistics;
    }

    private static GameMapEncoder prepare(GameMap map, FormatContext context, IssueCollector issues)
    {
        ItemIdEncoder ids = ItemIdEncoder.forTarget(context);
        new SavePreflight(context.version(), ids).check(map, issues);
        return new GameMapEncoder(context.version(), ids, context.itemDatabase());
    }

    private static SaveStatistics encode(GameMap map, GameMapEncoder encoder, OutputStream out) throws IOException
    {
        byte[] identifier = map.header().identifier().bytes();
        out.write(identifier);
        try {
            SaveStatistics tree = encoder.encode(map, new DefaultOtbmNodeWriter(out));
            return new SaveStatistics(tree.bytesWritten() + identifier.length, tree.tileAreas(), tree.tiles(), tree.items());
        }
        catch (IllegalArgumentException e) {
            throw new InvalidMapDataException("map cannot be written: " + e.getMessage(), e);
        }
    }
}
