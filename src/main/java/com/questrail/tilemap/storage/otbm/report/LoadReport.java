package com.questrail.tilemap.storage.otbm.report;

import com.questrail.tilemap.storage.otbm.format.FormatDescriptor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LoadReport
 * -----------------------------------------------------------------------------
 * Outcome of a load.
 *
 * <p>{@code success} is true exactly when no {@link MapIoFailure} occurred.
 * A successful load may still carry warnings and recoverable errors.</p>
 */
public record LoadReport(
        boolean success,
        List<MapIoIssue> warnings,
        List<MapIoIssue> recoverableErrors,
        int suppressedIssues,
        Optional<MapIoFailure> failure,
        Optional<FormatDescriptor> format,
        LoadStatistics statistics
) {
    public LoadReport {
        warnings = List.copyOf(warnings);
        recoverableErrors = List.copyOf(recoverableErrors);
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(statistics, "statistics");
        if (success == failure.isPresent()) {
            throw new IllegalArgumentException("success must be true exactly when no failure is present");
        }
    }

    public static LoadReport succeeded(IssueCollector issues, FormatDescriptor format, LoadStatistics statistics) {
        return new LoadReport(true, issues.warnings(), issues.recoverableErrors(), issues.suppressed(),
                Optional.empty(), Optional.of(format), statistics);
    }

    public static LoadReport failed(IssueCollector issues, MapIoFailure failure,
                                    Optional<FormatDescriptor> format, LoadStatistics statistics) {
        return new LoadReport(false, issues.warnings(), issues.recoverableErrors(), issues.suppressed(),
                Optional.of(failure), format, statistics);
    }

    public boolean hasIssue(IssueCode code) {
        return warnings.stream().anyMatch(i -> i.code() == code)
                || recoverableErrors.stream().anyMatch(i -> i.code() == code);
    }
}
