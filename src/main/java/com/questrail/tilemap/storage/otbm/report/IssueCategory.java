package com.questrail.tilemap.storage.otbm.report;

/**
 * How an issue is reported.
 *
 * <p>{@link #WARNING} issues describe data that was read as written but looks
 * suspicious. {@link #RECOVERABLE_ERROR} issues describe data that could not
 * be read as written and was substituted or preserved opaquely.</p>
 */
public enum IssueCategory
{
    WARNING,
    RECOVERABLE_ERROR
}
