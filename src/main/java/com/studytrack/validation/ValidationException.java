package com.studytrack.validation;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends RuntimeException {
    private final List<ValidationIssue> issues;

    public ValidationException(List<ValidationIssue> issues) {
        super(issues.stream().map(ValidationIssue::toString).collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public ValidationException(ValidationIssue issue) {
        this(List.of(issue));
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
