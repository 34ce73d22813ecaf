package com.questrail.tilemap.storage.otbm.version;

/**
 * Indicates a project file that exists but cannot be used.
 */
public final class ProjectMetadataException extends Exception
{
    public ProjectMetadataException(String message) {
        super(message);
    }

    public ProjectMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
