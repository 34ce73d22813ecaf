package com.questrail.tilemap.storage.otbm.report;

/**
 * Counters gathered while loading.
 *
 * @param largestPayload largest single node payload held in memory, in bytes
 * @param deepestNesting deepest node nesting seen, the root counting as one
 */
public record LoadStatistics(
        long bytesRead,
        int tileAreas,
        int tiles,
        long items,
        int largestPayload,
        int deepestNesting
) {
    public static final LoadStatistics EMPTY = new LoadStatistics(0, 0, 0, 0, 0, 0);
}
