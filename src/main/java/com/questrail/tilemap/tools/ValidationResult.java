package com.questrail.tilemap.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Issues found by one {@link MapValidator} run, in the order they were found.
 */
public final class ValidationResult
{
    private final List<ValidationIssue> issues = new ArrayList<>();

    void add(ValidationIssue issue) {
        issues.add(issue);
    }

    public List<ValidationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ValidationIssue> errors() {
        return bySeverity(ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return bySeverity(ValidationSeverity.WARNING);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == ValidationSeverity.ERROR);
    }

    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(i -> i.code().equals(code));
    }

    private List<ValidationIssue> bySeverity(ValidationSeverity severity) {
        return issues.stream().filter(i -> i.severity() == severity).collect(Collectors.toList());
    }
}
