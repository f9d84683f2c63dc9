package com.studytrack.validation;

public record ValidationIssue(String code, String message, String path, String field) {

    public String location() {
        return field == null ? path : path + "." + field;
    }

    @Override
    public String toString() {
        return code + " at " + location() + ": " + message;
    }
}
