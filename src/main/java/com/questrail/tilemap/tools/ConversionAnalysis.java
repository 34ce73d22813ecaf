package com.questrail.tilemap.tools;

import com.questrail.tilemap.storage.otbm.format.OtbmVersion;

import java.util.List;
import java.util.Objects;

/**
 * What converting a map to {@code target} would lose.
 *
 * @param placeholderItems items that still carry a placeholder id from loading
 * @param strandedPlaceholders placeholder items whose original id belongs to
 *                             the other id space and so cannot be written
 * @param missingMappings server ids without a client id, ascending
 * @param databaseMissing true when the target needs an item database and none is available
 */
public record ConversionAnalysis(
        OtbmVersion target,
        long totalItems,
        long placeholderItems,
        long strandedPlaceholders,
        List<Integer> missingMappings,
        boolean databaseMissing
) {
    public ConversionAnalysis {
        Objects.requireNonNull(target, "target");
        missingMappings = List.copyOf(missingMappings);
    }

    /**
     * True when a save to the target will pass its pre-flight check.
     */
    public boolean ok() {
        return !databaseMissing && missingMappings.isEmpty() && strandedPlaceholders == 0;
    }
}
