package com.questrail.tilemap.storage.otbm.error;

import com.questrail.tilemap.storage.otbm.report.MapIoFailure;

/**
 * Indicates a byte stream that is not a well-formed node tree.
 *
 * <p>This typically reflects:</p>
 * <ul>
 *   <li>an unescaped marker byte inside a payload</li>
 *   <li>a dangling escape byte or a truncated stream</li>
 *   <li>data between a node end and the next marker</li>
 *   <li>a node missing the fixed fields needed to place its content</li>
 * </ul>
 */
public final class StructuralCorruptionException extends MapFormatException
{
    private final long offset;
    private final String nodePath;

    public StructuralCorruptionException(String message, long offset, String nodePath) {
        super(message + " (offset " + offset + ", node " + nodePath + ")");
        this.offset = offset;
        this.nodePath = nodePath;
    }

    public long offset() {
        return offset;
    }

    public String nodePath() {
        return nodePath;
    }

    @Override
    public MapIoFailure toFailure() {
        return new MapIoFailure.StructuralCorruption(getMessage(), offset, nodePath);
    }
}
