package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.report.LoadReport;
import com.questrail.tilemap.storage.otbm.report.MapIoFailure;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;
import com.questrail.tilemap.storage.otbm.report.SaveReport;
import com.questrail.tilemap.storage.otbm.report.UnmappableItem;

import java.io.PrintWriter;

/**
 * Plain-text rendering of load and save reports for the console.
 */
final class ReportPrinter {

    private static final int MAX_LISTED_ITEMS = 10;

    private ReportPrinter() {}

    static void printIssues(LoadReport report, PrintWriter out) {
        for (MapIoIssue issue : report.warnings()) {
            out.println("  warning: " + issue);
        }
        for (MapIoIssue issue : report.recoverableErrors()) {
            out.println("  error:   " + issue);
        }
        if (report.suppressedIssues() > 0) {
            out.println("  ... " + report.suppressedIssues() + " more issues suppressed");
        }
    }

    static void printIssues(SaveReport report, PrintWriter out) {
        for (MapIoIssue issue : report.warnings()) {
            out.println("  warning: " + issue);
        }
    }

    static void printFailure(MapIoFailure failure, PrintWriter err) {
        err.println("Error: " + describe(failure));
        if (failure instanceof MapIoFailure.UnmappableId) {
            var items = ((MapIoFailure.UnmappableId) failure).items();
            items.stream().limit(MAX_LISTED_ITEMS).forEach(
                (UnmappableItem item) -> err.println("  item " + item.itemId() + " at " + item.position()));
            if (items.size() > MAX_LISTED_ITEMS) {
                err.println("  ... and " + (items.size() - MAX_LISTED_ITEMS) + " more");
            }
        }
    }

    private static String describe(MapIoFailure failure) {
        if (failure instanceof MapIoFailure.StructuralCorruption) {
            return "map file is corrupt: " + failure.message();
        }
        if (failure instanceof MapIoFailure.VersionUnsupported) {
            return "unsupported map version " + ((MapIoFailure.VersionUnsupported) failure).version()
                + " (use --allow-unsupported to read it anyway)";
        }
        if (failure instanceof MapIoFailure.ItemDatabaseUnavailable) {
            return failure.message() + " (use --items-otb)";
        }
        return failure.message();
    }
}
