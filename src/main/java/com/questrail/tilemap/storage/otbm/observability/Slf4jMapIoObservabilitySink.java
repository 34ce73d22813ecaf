package com.questrail.tilemap.storage.otbm.observability;

import com.questrail.tilemap.storage.otbm.report.LoadReport;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.report.SaveReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MapIoObservabilitySink that emits logs via SLF4J.
 *
 * <p>Completed operations are logged at info, individual issues at debug.</p>
 */
public final class Slf4jMapIoObservabilitySink implements MapIoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMapIoObservabilitySink.class);

    @Override
    public void onLoadCompleted(LoadCompletedEvent event) {
        LoadReport report = event.report();
        if (!report.success()) {
            return;
        }
        log.info("Loaded {} as {} in {} ms: {} tiles, {} items, {} warnings, {} recoverable errors",
            event.source(),
            report.format().map(f -> f.version().toString()).orElse("?"),
            event.elapsed().toMillis(),
            report.statistics().tiles(),
            report.statistics().items(),
            report.warnings().size(),
            report.recoverableErrors().size());

        if (log.isDebugEnabled()) {
            for (MapIoIssue issue : report.warnings()) {
                log.debug("  {}", issue);
            }
            for (MapIoIssue issue : report.recoverableErrors()) {
                log.debug("  {}", issue);
            }
            if (report.suppressedIssues() > 0) {
                log.debug("  ... {} more issues suppressed", report.suppressedIssues());
            }
        }
    }

    @Override
    public void onSaveCompleted(SaveCompletedEvent event) {
        SaveReport report = event.report();
        if (!report.success()) {
            return;
        }
        log.info("Saved {} as {} in {} ms: {} bytes, {} tiles, {} warnings",
            event.destination(),
            event.target(),
            event.elapsed().toMillis(),
            report.statistics().bytesWritten(),
            report.statistics().tiles(),
            report.warnings().size());
        for (MapIoIssue issue : report.warnings()) {
            log.debug("  {}", issue);
        }
    }

    @Override
    public void onError(MapIoErrorEvent event) {
        log.error("Map {} of {} failed: {}", event.operation(), event.subject(), event.failure().message(), event.cause());
    }
}
