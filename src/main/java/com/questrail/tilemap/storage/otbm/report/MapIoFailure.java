package com.questrail.tilemap.storage.otbm.report;

import java.util.List;
import java.util.Objects;

/**
 * MapIoFailure
 * -----------------------------------------------------------------------------
 * The reason a load or save did not complete.
 *
 * <p>A failure is a value: it is carried on the report rather than thrown, so
 * callers branch on the variant instead of parsing messages.</p>
 */
public sealed interface MapIoFailure
{
    String message();

    /**
     * The byte stream is not a well-formed node tree, or a node lacks the
     * fields needed to place its content.
     */
    record StructuralCorruption(String message, long offset, String nodePath) implements MapIoFailure {}

    /**
     * One or more items have no representation in the target id space.
     */
    record UnmappableId(String message, List<UnmappableItem> items) implements MapIoFailure {
        public UnmappableId {
            items = List.copyOf(items);
        }
    }

    record ResourceLimitExceeded(String message, String limit, long threshold, long observed) implements MapIoFailure {}

    record VersionUnsupported(String message, long version) implements MapIoFailure {}

    record ItemDatabaseUnavailable(String message) implements MapIoFailure {}

    record Cancelled(String message) implements MapIoFailure {}

    /**
     * The in-memory map holds a value the file format cannot store.
     */
    record InvalidMapData(String message) implements MapIoFailure {}

    record IoFailure(String message, Throwable cause) implements MapIoFailure {
        public IoFailure {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
