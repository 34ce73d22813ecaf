package com.questrail.tilemap.storage.otbm.report;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates issues for one load or save.
 *
 * <p>At most {@code perCodeLimit} issues of each code are retained; later ones
 * are only counted, so a file with a systematic defect cannot flood the report.
 * Instances are confined to the calling thread.</p>
 */
public final class IssueCollector
{
    private final int perCodeLimit;
    private final Map<IssueCode, Integer> counts = new EnumMap<>(IssueCode.class);
    private final List<MapIoIssue> warnings = new ArrayList<>();
    private final List<MapIoIssue> recoverableErrors = new ArrayList<>();
    private int suppressed;

    public IssueCollector(int perCodeLimit) {
        if (perCodeLimit <= 0) {
            throw new IllegalArgumentException("perCodeLimit must be positive");
        }
        this.perCodeLimit = perCodeLimit;
    }

    public void report(MapIoIssue issue) {
        int seen = counts.merge(issue.code(), 1, Integer::sum);
        if (seen > perCodeLimit) {
            suppressed++;
            return;
        }
        if (issue.category() == IssueCategory.WARNING) {
            warnings.add(issue);
        } else {
            recoverableErrors.add(issue);
        }
    }

    /**
     * Total number of issues reported with {@code code}, suppressed ones included.
     */
    public int count(IssueCode code) {
        return counts.getOrDefault(code, 0);
    }

    public List<MapIoIssue> warnings() {
        return List.copyOf(warnings);
    }

    public List<MapIoIssue> recoverableErrors() {
        return List.copyOf(recoverableErrors);
    }

    public int suppressed() {
        return suppressed;
    }
}
