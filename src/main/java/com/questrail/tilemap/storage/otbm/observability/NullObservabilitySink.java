package com.questrail.tilemap.storage.otbm.observability;

/**
 * No-op implementation of MapIoObservabilitySink.
 */
public final class NullObservabilitySink implements MapIoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLoadCompleted(LoadCompletedEvent event) {}

    @Override
    public void onSaveCompleted(SaveCompletedEvent event) {}

    @Override
    public void onError(MapIoErrorEvent event) {}
}
