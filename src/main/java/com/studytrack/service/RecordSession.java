package com.studytrack.service;

import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.JsonRecordRepository;
import com.studytrack.repository.MalformedStoreException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Slf4j
public class RecordSession {
    private final JsonRecordRepository repository;
    private final Path storePath;
    private Student current;
    private boolean dirty;

    public RecordSession(JsonRecordRepository repository, Path storePath) {
        this.repository = repository;
        this.storePath = storePath;
    }

    /**
     * Reads the store. Returns false when there is no store yet. On a malformed store the
     * exception propagates and the tree held so far is kept.
     */
    public boolean load() throws MalformedStoreException {
        Optional<Student> loaded = repository.read(storePath);
        loaded.ifPresent(student -> {
            current = student;
            dirty = false;
        });
        return loaded.isPresent();
    }

    public Optional<Student> current() {
        return Optional.ofNullable(current);
    }

    public Student require() {
        if (current == null) {
            throw new IllegalStateException("No record loaded from " + storePath);
        }
        return current;
    }

    public Student apply(UnaryOperator<Student> mutation) {
        Student next = Objects.requireNonNull(mutation.apply(require()), "mutation result");
        replace(next);
        return next;
    }

    public void replace(Student student) {
        current = Objects.requireNonNull(student, "student");
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    /** Writes the current tree if it changed since the last load or checkpoint. */
    public boolean checkpoint() {
        if (current == null || !dirty) {
            log.debug("Nothing to save to {}", storePath);
            return false;
        }
        repository.write(storePath, current);
        dirty = false;
        return true;
    }

    public Path getStorePath() {
        return storePath;
    }
}
