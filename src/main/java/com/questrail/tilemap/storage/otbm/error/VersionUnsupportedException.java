package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

public final class VersionUnsupportedException extends MapFormatException
{
    private final long version;

    public VersionUnsupportedException(long version) {
        super("unsupported map version " + version);
        this.version = version;
    }

    public long version() {
        return version;
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.VersionUnsupported(getMessage(), version);
    }
}
