package io.logtabulator.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/**
 * Creates and removes the per-stage staging directories of a run.
 * <p>
 * A staging directory that already exists and is not empty is an error unless {@code allowExisting} is set;
 * runs never resume from leftovers of an earlier run.
 */
@Slf4j
@RequiredArgsConstructor
public class StagingDirectories {

    private final boolean allowExisting;
    private final boolean deleteAfterUse;

    public void create(Path dir) {
        if (Files.exists(dir)) {
            if (!allowExisting && !isEmptyDirectory(dir)) {
                throw new PipelineException("Cannot create a directory when that directory already exists: `" + dir + "`");
            }
            log.debug("Reusing directory: {}", dir);
            return;
        }
        log.debug("Creating directory: {}", dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }

    public void release(Path dir) {
        if (!deleteAfterUse) {
            log.debug("Keeping directory: {}", dir);
            return;
        }
        log.debug("Removing directory: {}", dir);
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove directory " + dir, e);
        }
    }

    private static boolean isEmptyDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
