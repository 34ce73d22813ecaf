package com.questrail.tilemap.storage.otbm.runtime;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * AtomicFileWriter
 * -----------------------------------------------------------------------------
 * Replaces a file so that readers see either the old or the new content.
 *
 * <p>Content goes to a temporary file in the destination's directory, is
 * forced to disk and then moved over the destination. When the body or the
 * move fails, the temporary file is deleted and the destination is left as it
 * was. File systems without atomic rename fall back to a plain replacing
 * move.</p>
 */
public final class AtomicFileWriter
{
    @FunctionalInterface
    public interface Body<T>
    {
        T writeTo(OutputStream out) throws IOException;
    }

    public <T> T write(Path destination, Body<T> body) throws IOException
    {
        Path target = destination.toAbsolutePath();
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path temp = directory.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");

        try {
            T result;
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel), 64 * 1024);
                result = body.writeTo(out);
                out.flush();
                channel.force(true);
            }
            move(temp, target);
            return result;
        }
        catch (IOException | RuntimeException e) {
            deleteQuietly(temp, e);
            throw e;
        }
    }

    private static void move(Path temp, Path target) throws IOException
    {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            // Same directory, so only exotic file systems get here.
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // A failed cleanup travels with the original failure.
    private static void deleteQuietly(Path temp, Exception primary)
    {
        try {
            Files.deleteIfExists(temp);
        }
        catch (IOException cleanupEx) {
            primary.addSuppressed(cleanupEx);
        }
    }
}
