package com.questrail.tilemap.tools;

public enum ValidationSeverity
{
    ERROR,
    WARNING
}
