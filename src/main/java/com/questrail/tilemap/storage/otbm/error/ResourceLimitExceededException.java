package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

public final class ResourceLimitExceededException extends MapFormatException
{
    private final String limit;
    private final long threshold;
    private final long observed;

    public ResourceLimitExceededException(String limit, long threshold, long observed) {
        super(limit + " exceeded: " + observed + " > " + threshold);
        this.limit = limit;
        this.threshold = threshold;
        this.observed = observed;
    }

    public String limit() {
        return limit;
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.ResourceLimitExceeded(getMessage(), limit, threshold, observed);
    }
}
