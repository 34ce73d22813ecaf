package com.questrail.tilemap.storage.otbm.version;

public enum MapFileKind
{
    OTBM,
    PROJECT_JSON,
    UNKNOWN
}
