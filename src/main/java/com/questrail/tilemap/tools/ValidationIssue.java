package com.questrail.tilemap.tools;

import com.questrail.tilemap.api.Position;

import java.util.Objects;
import java.util.Optional;

/**
 * One finding of {@link MapValidator}.
 *
 * @param code stable upper-case identifier, e.g. {@code HOUSE_ID_MISSING}
 */
public record ValidationIssue(ValidationSeverity severity, String code, String message, Optional<Position> position)
{
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message + position.map(p -> " at " + p).orElse("");
    }
}
