package com.questrail.tilemap.storage.otbm.format;

/**
 * Which input decided a {@link FormatDescriptor}.
 */
public enum ResolutionSource
{
    /** Constructed directly by the caller. */
    EXPLICIT,
    WORKSPACE_HINT,
    FILE_HEADER,
    ITEM_DATABASE,
    FALLBACK
}
