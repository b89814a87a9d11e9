package io.logtabulator.runner;

import io.logtabulator.config.PipelineProperties;
import io.logtabulator.service.ChunkFiles;
import io.logtabulator.service.LogFileTabulationService;
import io.logtabulator.service.dto.TabulationRequest;
import io.logtabulator.service.dto.TabulationResult;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Command line entry point:
 * <pre>
 * java -jar log-tabulator.jar [--out=&lt;dir&gt;] &lt;log-file&gt;...
 * </pre>
 * With a single file the output directory is used as is; with several files every file gets a
 * sub-directory named after it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.runner.enabled", havingValue = "true", matchIfMissing = true)
public class TabulateCommandRunner implements ApplicationRunner {

    static final String OUT_OPTION = "out";

    private final LogFileTabulationService tabulationService;
    private final PipelineProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        List<TabulationResult> results = tabulationService.tabulateAll(toRequests(args));
        if (results.isEmpty()) {
            return;
        }
        long succeeded = results.stream().filter(TabulationResult::isSucceeded).count();
        log.info("Tabulated {} of {} file(s)", succeeded, results.size());
        for (TabulationResult result : results) {
            if (result.isSucceeded()) {
                log.info("  {} -> {} ({} lines, matched {}, unparsed {})", result.source(), result.outputDir(),
                        result.totals().lines(), result.totals().matched(), result.totals().unparsed());
            } else {
                log.warn("  {} {}: {}", result.source(), result.status(), result.failure());
            }
        }
    }

    List<TabulationRequest> toRequests(ApplicationArguments args) {
        List<Path> sources = args.getNonOptionArgs().stream().map(Path::of).toList();
        if (sources.isEmpty()) {
            log.info("No log files given. Usage: log-tabulator [--{}=<dir>] <log-file>...", OUT_OPTION);
            return List.of();
        }
        String out = properties.getOutputDir();
        List<String> outValues = args.getOptionValues(OUT_OPTION);
        if (outValues != null && !outValues.isEmpty()) {
            out = outValues.get(outValues.size() - 1);
        }
        if (!StringUtils.hasText(out)) {
            return sources.stream().map(TabulationRequest::of).toList();
        }
        Path outputRoot = Path.of(out);
        if (sources.size() == 1) {
            return List.of(new TabulationRequest(sources.get(0), outputRoot));
        }
        return sources.stream()
                .map(source -> new TabulationRequest(source, outputRoot.resolve(ChunkFiles.stem(source))))
                .toList();
    }
}
