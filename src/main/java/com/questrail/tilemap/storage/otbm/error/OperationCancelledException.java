package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

public final class OperationCancelledException extends MapFormatException
{
    public OperationCancelledException(String message) {
        super(message);
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.Cancelled(getMessage());
    }
}
