package io.logtabulator.config;

import io.logtabulator.parser.LogParser;
import io.logtabulator.service.ChunkFiles;
import io.logtabulator.table.TableExporter;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.With;

/**
 * Immutable settings of one tabulation run, handed to every stage.
 *
 * @param parsers                   parsers in priority order
 * @param chunkByteSize             target chunk size in bytes
 * @param maxThreads                worker pool bound for the parallel stages
 * @param deleteIntermediateDirs    remove staging directories once consumed
 * @param allowExistingStagingDirs  accept non-empty pre-existing staging directories
 * @param tableExporter             writer of the per-chunk tables
 */
@With
public record PipelineSettings(
        List<LogParser> parsers,
        long chunkByteSize,
        int maxThreads,
        boolean deleteIntermediateDirs,
        boolean allowExistingStagingDirs,
        TableExporter tableExporter) {

    public static final long DEFAULT_CHUNK_BYTE_SIZE = 1_000_000_000L;

    private static final Pattern SHORT_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    public PipelineSettings {
        parsers = List.copyOf(Objects.requireNonNull(parsers, "parsers"));
        Objects.requireNonNull(tableExporter, "tableExporter");
        if (chunkByteSize <= 0) {
            throw new IllegalArgumentException("Chunk byte size must be positive: " + chunkByteSize);
        }
        if (maxThreads <= 0) {
            throw new IllegalArgumentException("Max threads must be positive: " + maxThreads);
        }
        Set<String> names = new HashSet<>();
        for (LogParser parser : parsers) {
            String name = parser.shortName();
            if (name == null || !SHORT_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid parser short name: '" + name + "'");
            }
            if (ChunkFiles.UNPARSED_NAME.equals(name)) {
                throw new IllegalArgumentException("Parser short name '" + name + "' is reserved for unparsed lines");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Duplicate parser short name: '" + name + "'");
            }
        }
    }

    public static PipelineSettings defaults(List<LogParser> parsers, TableExporter tableExporter) {
        return new PipelineSettings(parsers, DEFAULT_CHUNK_BYTE_SIZE, Runtime.getRuntime().availableProcessors(),
                true, false, tableExporter);
    }
}
