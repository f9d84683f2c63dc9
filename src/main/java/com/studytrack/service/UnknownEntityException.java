package com.studytrack.service;

public class UnknownEntityException extends RuntimeException {
    private final String entity;
    private final String key;

    public UnknownEntityException(String entity, String key) {
        super("No " + entity + " found with key " + key);
        this.entity = entity;
        this.key = key;
    }

    public String getEntity() {
        return entity;
    }

    public String getKey() {
        return key;
    }
}
