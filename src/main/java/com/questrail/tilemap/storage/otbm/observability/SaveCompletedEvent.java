package com.questrail.tilemap.storage.otbm.observability;

import com.questrail.tilemap.storage.otbm.format.OtbmVersion;
import com.questrail.tilemap.storage.otbm.report.SaveReport;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a finished save.
 */
public record SaveCompletedEvent(
    Instant timestamp,
    String destination,
    OtbmVersion target,
    Duration elapsed,
    SaveReport report
) {
}
