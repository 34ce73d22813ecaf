package com.questrail.tilemap.storage.otbm.report;

import com.questrail.tilemap.api.Position;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A single non-fatal finding of a load or save.
 */
public record MapIoIssue(
        IssueCode code,
        String message,
        Optional<Position> position,
        OptionalInt rawId
) {
    public MapIoIssue {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(rawId, "rawId");
    }

    public static MapIoIssue of(IssueCode code, String message) {
        return new MapIoIssue(code, message, Optional.empty(), OptionalInt.empty());
    }

    public static MapIoIssue at(IssueCode code, String message, Position position) {
        return new MapIoIssue(code, message, Optional.ofNullable(position), OptionalInt.empty());
    }

    public static MapIoIssue forItem(IssueCode code, String message, Position position, int rawId) {
        return new MapIoIssue(code, message, Optional.ofNullable(position), OptionalInt.of(rawId));
    }

    public IssueCategory category() {
        return code.category();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.name()).append(": ").append(message);
        position.ifPresent(p -> sb.append(" at ").append(p));
        return sb.toString();
    }
}
