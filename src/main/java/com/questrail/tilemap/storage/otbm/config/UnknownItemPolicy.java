package com.questrail.tilemap.storage.otbm.config;

/**
 * What a load does with an item id that cannot be resolved to a known ServerID.
 */
public enum UnknownItemPolicy
{
    /**
     * Substitute the placeholder id, remember the raw id on the item, report
     * a recoverable error.
     */
    PLACEHOLDER,

    /**
     * Keep the raw id as the ServerID and report a recoverable error. Only
     * meaningful for ServerID-space files; ClientID-space files fall back to
     * {@link #PLACEHOLDER}.
     */
    KEEP,

    /**
     * Abort the load with an unmappable-id failure.
     */
    FAIL
}
