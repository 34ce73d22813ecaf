package com.questrail.tilemap.storage.otbm.report;

import com.questrail.tilemap.api.Position;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class IssueCollectorTest
{
    @Test
    void issuesAreSortedByCategory() {
        IssueCollector c = new IssueCollector(10);
        c.report(MapIoIssue.of(IssueCode.DUPLICATE_TILE, "dup"));
        c.report(MapIoIssue.forItem(IssueCode.UNMAPPED_ITEM_ID, "no mapping", Position.of(1, 2, 7), 9999));

        assertEquals(1, c.warnings().size());
        assertEquals(1, c.recoverableErrors().size());
        MapIoIssue error = c.recoverableErrors().get(0);
        assertEquals(9999, error.rawId().getAsInt());
        assertEquals(Position.of(1, 2, 7), error.position().orElseThrow());
        assertEquals(IssueCategory.RECOVERABLE_ERROR, error.category());
    }

    /**
     * A systematic defect produces at most the per-code limit of entries; the
     * rest are only counted.
     */
    @Test
    void issuesBeyondPerCodeLimitAreCountedNotKept() {
        IssueCollector c = new IssueCollector(3);
        for (int i = 0; i < 10; i++) {
            c.report(MapIoIssue.of(IssueCode.UNKNOWN_ATTRIBUTE, "attr " + i));
        }
        c.report(MapIoIssue.of(IssueCode.MALFORMED_NODE, "node"));

        assertEquals(4, c.recoverableErrors().size());
        assertEquals(10, c.count(IssueCode.UNKNOWN_ATTRIBUTE));
        assertEquals(7, c.suppressed());
        assertEquals(0, c.count(IssueCode.DATA_DROPPED));
    }

    @Test
    void reportsAreSnapshots() {
        IssueCollector c = new IssueCollector(10);
        c.report(MapIoIssue.of(IssueCode.DATA_DROPPED, "zones"));
        SaveReport report = SaveReport.succeeded(c, SaveStatistics.EMPTY);
        c.report(MapIoIssue.of(IssueCode.DATA_DROPPED, "tier"));

        assertEquals(1, report.warnings().size());
        assertTrue(report.hasWarning(IssueCode.DATA_DROPPED));
    }

    @Test
    void successAndFailureAreExclusive() {
        IssueCollector c = new IssueCollector(10);
        LoadReport failed = LoadReport.failed(c, new MapIoFailure.Cancelled("stop"),
                Optional.empty(), LoadStatistics.EMPTY);
        assertFalse(failed.success());
        assertEquals("stop", failed.failure().orElseThrow().message());
        assertThrows(IllegalArgumentException.class, () -> new LoadReport(true, List.of(),
                List.of(), 0, Optional.of(new MapIoFailure.Cancelled("x")),
                Optional.empty(), LoadStatistics.EMPTY));
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new IssueCollector(0));
    }
}
