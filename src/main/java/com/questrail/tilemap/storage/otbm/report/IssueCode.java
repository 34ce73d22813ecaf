package com.questrail.tilemap.storage.otbm.report;

/**
 * Stable codes for non-fatal load and save issues.
 */
public enum IssueCode
{
    MISLABELED_IDENTIFIER(IssueCategory.WARNING),
    UNSUPPORTED_VERSION_ACCEPTED(IssueCategory.WARNING),
    VERSION_HINT_MISMATCH(IssueCategory.WARNING),
    PROJECT_METADATA_ERROR(IssueCategory.WARNING),
    ITEM_DATABASE_ERROR(IssueCategory.WARNING),
    TILE_OUT_OF_BOUNDS(IssueCategory.WARNING),
    DUPLICATE_TILE(IssueCategory.WARNING),
    DANGLING_HOUSE_REFERENCE(IssueCategory.WARNING),
    RESOURCE_THRESHOLD(IssueCategory.WARNING),
    DATA_DROPPED(IssueCategory.WARNING),

    UNKNOWN_NODE(IssueCategory.RECOVERABLE_ERROR),
    MALFORMED_NODE(IssueCategory.RECOVERABLE_ERROR),
    UNKNOWN_ATTRIBUTE(IssueCategory.RECOVERABLE_ERROR),
    MALFORMED_ATTRIBUTE(IssueCategory.RECOVERABLE_ERROR),
    UNMAPPED_ITEM_ID(IssueCategory.RECOVERABLE_ERROR),
    UNKNOWN_ITEM_ID(IssueCategory.RECOVERABLE_ERROR);

    private final IssueCategory category;

    IssueCode(IssueCategory category) {
        this.category = category;
    }

    public IssueCategory category() {
        return category;
    }
}
