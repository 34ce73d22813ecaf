package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;
import com.questrail.tilemap.storage.otbm.report.UnmappableItem;

import java.util.List;

public final class UnmappableIdException extends MapFormatException
{
    private final List<UnmappableItem> items;

    public UnmappableIdException(String message, List<UnmappableItem> items) {
        super(message);
        this.items = List.copyOf(items);
    }

    public List<UnmappableItem> items() {
        return items;
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.UnmappableId(getMessage(), items);
    }
}
