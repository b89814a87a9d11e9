package io.logtabulator.service.dto;

import java.nio.file.Path;

/**
 * Renders one chunk's records file of one parser into a table under {@code destDir}.
 */
public record TabularizeTask(TableSchema schema, Path recordsFile, Path destDir) {
}
