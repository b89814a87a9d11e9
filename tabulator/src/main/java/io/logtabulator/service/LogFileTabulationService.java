package io.logtabulator.service;

import io.logtabulator.config.PipelineSettings;
import io.logtabulator.parser.LogParser;
import io.logtabulator.service.dto.ChunkParseSummary;
import io.logtabulator.service.dto.ParseTotals;
import io.logtabulator.service.dto.TableSchema;
import io.logtabulator.service.dto.TabularizeTask;
import io.logtabulator.service.dto.TabulationRequest;
import io.logtabulator.service.dto.TabulationResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

/**
 * Turns one log file into per-parser tables and a file of unparsed lines:
 * <pre>
 * split -> parse chunks (parallel) -> unify headers -> tabularize chunks (parallel) -> merge
 * </pre>
 * Stages communicate through staging directories inside the output directory. Any fault inside the
 * stages is logged and reported as a failed {@link TabulationResult}; nothing is retried or cleaned up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogFileTabulationService {

    private static final DateTimeFormatter RUN_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String MDC_SOURCE = "source";

    private final FileSplitter splitter;
    private final ChunkParser chunkParser;
    private final SchemaUnifier schemaUnifier;
    private final ChunkTabularizer tabularizer;
    private final ChunkMerger merger;
    private final PipelineSettings settings;

    public TabulationResult tabulate(Path source) {
        return tabulate(source, null);
    }

    public TabulationResult tabulate(Path source, Path outputDir) {
        return tabulate(source, outputDir, settings);
    }

    /**
     * @throws IllegalArgumentException when the source does not exist or the explicit output directory does
     */
    public TabulationResult tabulate(Path source, Path outputDir, PipelineSettings runSettings) {
        if (!Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Specified source file does not exist: " + source);
        }
        if (outputDir != null && Files.exists(outputDir)) {
            throw new IllegalArgumentException("Specified output directory already exists: " + outputDir);
        }
        Path resolvedOutputDir = outputDir != null ? outputDir : defaultOutputDir(source);

        log.info("Parsing: {}", source);
        StopWatch watch = new StopWatch(source.getFileName().toString());
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SOURCE, source.getFileName().toString())) {
            try {
                RunOutcome outcome = runStages(source, resolvedOutputDir, runSettings, watch);
                Duration wallTime = Duration.ofNanos(watch.getTotalTimeNanos());
                log.info("Parsing completed (wall time: {})", formatDuration(wallTime));
                log.debug("Stage timings:\n{}", watch.prettyPrint());
                return TabulationResult.succeeded(source, resolvedOutputDir, outcome.outputs(), outcome.totals(),
                        wallTime);
            } catch (Exception e) {
                if (watch.isRunning()) {
                    watch.stop();
                }
                log.error("FATAL: Parsing failed with exception: {}", e.getMessage(), e);
                return TabulationResult.failed(source, resolvedOutputDir, Duration.ofNanos(watch.getTotalTimeNanos()), e);
            }
        }
    }

    /**
     * Tabulates the requested files one after another. A rejected or failed file does not stop the batch.
     */
    public List<TabulationResult> tabulateAll(List<TabulationRequest> requests) {
        List<TabulationResult> results = new ArrayList<>(requests.size());
        for (TabulationRequest request : requests) {
            try {
                results.add(tabulate(request.source(), request.outputDir()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping {}: {}", request.source(), e.getMessage());
                results.add(TabulationResult.rejected(request.source(), request.outputDir(), e.getMessage()));
            }
        }
        return results;
    }

    private RunOutcome runStages(Path source, Path outputDir, PipelineSettings runSettings, StopWatch watch)
            throws IOException {
        String sourceBaseName = ChunkFiles.stem(source);
        Path splitDir = outputDir.resolve(ChunkFiles.SPLIT_DIR);
        Path parsedDir = outputDir.resolve(ChunkFiles.PARSED_DIR);
        Path tabularizedDir = outputDir.resolve(ChunkFiles.TABULARIZED_DIR);

        List<LogParser> parsers = runSettings.parsers();
        StagingDirectories staging = new StagingDirectories(
                runSettings.allowExistingStagingDirs(), runSettings.deleteIntermediateDirs());
        ParallelTaskExecutor executor = new ParallelTaskExecutor(runSettings.maxThreads());

        log.info("Initializing output directory: {}", outputDir);
        Files.createDirectories(outputDir.toAbsolutePath().getParent());
        Files.createDirectory(outputDir);

        watch.start("split");
        log.info("STAGE_1: Splitting source file into chunks...");
        staging.create(splitDir);
        List<Path> chunks = splitter.split(source, splitDir, runSettings.chunkByteSize());
        log.info("STAGE_1: Source file split into {} chunk(s)", chunks.size());
        watch.stop();

        watch.start("parse");
        log.info("STAGE_2: Parsing source file chunks...");
        staging.create(parsedDir);
        Queue<ChunkParseSummary> summaries = new ConcurrentLinkedQueue<>();
        executor.executeParallel("parse",
                chunk -> summaries.add(chunkParser.parseChunk(chunk, parsedDir, parsers)), chunks);
        staging.release(splitDir);
        ParseTotals totals = ParseTotals.sum(parsers.stream().map(LogParser::shortName).toList(), summaries);
        log.info("STAGE_2: Done parsing source file chunks ({} lines, matched {}, unparsed {})",
                totals.lines(), totals.matched(), totals.unparsed());
        watch.stop();

        watch.start("unify");
        log.info("STAGE_3: Gathering unique feature names...");
        Map<String, TableSchema> schemas = schemaUnifier.unify(parsedDir, parsers);
        log.info("STAGE_3: Done gathering unique feature names");
        watch.stop();

        watch.start("tabularize");
        log.info("STAGE_4: Tabularizing parsed file chunks...");
        staging.create(tabularizedDir);
        List<TabularizeTask> tasks = tabularizer.plan(parsedDir, tabularizedDir, schemas.values());
        executor.executeParallel("tabularize",
                task -> tabularizer.tabularizeChunk(task, runSettings.tableExporter()), tasks);
        log.info("STAGE_4: Done tabularizing parsed file chunks");
        watch.stop();

        List<Path> outputs = new ArrayList<>();

        watch.start("merge-unparsed");
        log.info("STAGE_5: Merging unparsed file chunks...");
        outputs.add(merger.mergeUnparsed(parsedDir, outputDir, sourceBaseName));
        staging.release(parsedDir);
        log.info("STAGE_5: Done merging unparsed file chunks");
        watch.stop();

        watch.start("merge-tables");
        log.info("STAGE_6: Merging parsed file chunks...");
        for (int i = 0; i < parsers.size(); i++) {
            Optional<Path> merged = merger.mergeTables(tabularizedDir, outputDir, sourceBaseName,
                    parsers.get(i).shortName(), i + 1, parsers.size());
            merged.ifPresent(outputs::add);
        }
        staging.release(tabularizedDir);
        log.info("STAGE_6: Done merging parsed file chunks");
        watch.stop();

        return new RunOutcome(outputs, totals);
    }

    private record RunOutcome(List<Path> outputs, ParseTotals totals) {
    }

    private static Path defaultOutputDir(Path source) {
        Path parent = source.toAbsolutePath().getParent();
        String timestamp = LocalDateTime.now().format(RUN_TIMESTAMP);
        return parent.resolve(ChunkFiles.stem(source) + "_" + timestamp);
    }

    static String formatDuration(Duration duration) {
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        int millis = duration.toMillisPart();
        return "%d:%02d:%02d.%03d".formatted(hours, minutes, seconds, millis);
    }
}
