package com.questrail.tilemap.storage.otbm.observability;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

import java.time.Instant;

/**
 * Record representing a failed load or save.
 *
 * @param cause the underlying exception, or null when the failure carries none
 */
public record MapIoErrorEvent(
    Instant timestamp,
    String operation,
    String subject,
    MapIoFailure failure,
    Throwable cause
) {
}
