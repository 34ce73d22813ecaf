package com.questrail.tilemap.storage.otbm.report;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a save. When {@code success} is false the destination file was
 * not modified.
 */
public record SaveReport(
        boolean success,
        List<MapIoIssue> warnings,
        Optional<MapIoFailure> failure,
        SaveStatistics statistics
) {
    public SaveReport {
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(statistics, "statistics");
        if (success == failure.isPresent()) {
            throw new IllegalArgumentException("success must be true exactly when no failure is present");
        }
    }

    public static SaveReport succeeded(IssueCollector issues, SaveStatistics statistics) {
        return new SaveReport(true, issues.warnings(), Optional.empty(), statistics);
    }

    public static SaveReport failed(IssueCollector issues, MapIoFailure failure) {
        return new SaveReport(false, issues.warnings(), Optional.of(failure), SaveStatistics.EMPTY);
    }

    public boolean hasWarning(IssueCode code) {
        return warnings.stream().anyMatch(i -> i.code() == code);
    }
}
