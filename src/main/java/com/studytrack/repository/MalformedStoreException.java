package com.studytrack.repository;

import com.studytrack.validation.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

public class MalformedStoreException extends Exception {
    private final List<ValidationIssue> issues;

    public MalformedStoreException(List<ValidationIssue> issues) {
        super(issues.stream().map(ValidationIssue::toString).collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public MalformedStoreException(ValidationIssue issue, Throwable cause) {
        super(issue.toString(), cause);
        this.issues = List.of(issue);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public String getPath() {
        return issues.get(0).path();
    }

    public String getField() {
        return issues.get(0).field();
    }
}
