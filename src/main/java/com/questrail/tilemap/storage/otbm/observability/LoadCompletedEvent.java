package com.questrail.tilemap.storage.otbm.observability;

import com.questrail.tilemap.storage.otbm.report.LoadReport;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a finished load.
 *
 * @param source file path or stream description
 */
public record LoadCompletedEvent(
    Instant timestamp,
    String source,
    Duration elapsed,
    LoadReport report
) {
}
