package io.logtabulator.service.dto;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record TabulationResult(
        Path source,
        Path outputDir,
        Status status,
        List<Path> outputs,
        ParseTotals totals,
        Duration wallTime,
        String failure) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        REJECTED
    }

    public TabulationResult {
        outputs = List.copyOf(outputs);
    }

    public static TabulationResult succeeded(Path source, Path outputDir, List<Path> outputs, ParseTotals totals,
                                             Duration wallTime) {
        return new TabulationResult(source, outputDir, Status.SUCCEEDED, outputs, totals, wallTime, null);
    }

    public static TabulationResult failed(Path source, Path outputDir, Duration wallTime, Throwable cause) {
        return new TabulationResult(source, outputDir, Status.FAILED, List.of(), ParseTotals.EMPTY, wallTime,
                String.valueOf(cause.getMessage()));
    }

    public static TabulationResult rejected(Path source, Path outputDir, String reason) {
        return new TabulationResult(source, outputDir, Status.REJECTED, List.of(), ParseTotals.EMPTY, Duration.ZERO,
                reason);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
