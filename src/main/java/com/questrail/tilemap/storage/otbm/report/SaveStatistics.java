package com.questrail.tilemap.storage.otbm.report;

public record SaveStatistics(long bytesWritten, int tileAreas, int tiles, long items)
{
    public static final SaveStatistics EMPTY = new SaveStatistics(0, 0, 0, 0);
}
