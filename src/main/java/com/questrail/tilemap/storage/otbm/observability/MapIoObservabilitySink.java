package com.questrail.tilemap.storage.otbm.observability;

/**
 * Main interface for receiving map storage observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface MapIoObservabilitySink {
    /**
     * Called when a load finishes, successfully or not.
     * @param event the load outcome
     */
    void onLoadCompleted(LoadCompletedEvent event);

    /**
     * Called when a save finishes, successfully or not.
     * @param event the save outcome
     */
    void onSaveCompleted(SaveCompletedEvent event);

    /**
     * Called when a load or save ends in a failure.
     * @param event the error event
     */
    void onError(MapIoErrorEvent event);
}
