package com.studytrack.repository;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
public final class StoreFiles {

    private StoreFiles() {}

    /**
     * Writes to a temporary sibling first and moves it over the target, so a failed write
     * never leaves a truncated file behind.
     */
    public static void writeAtomically(Path target, byte[] content) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                out.write(content);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + absolute, e);
        } finally {
            cleanUp(temp);
        }
    }

    public static byte[] read(Path source) {
        try (var in = Files.newInputStream(source)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source.toAbsolutePath(), e);
        }
    }

    private static void cleanUp(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
