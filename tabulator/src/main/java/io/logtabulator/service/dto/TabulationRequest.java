package io.logtabulator.service.dto;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param source    log file to tabulate
 * @param outputDir output directory that must not exist yet, or {@code null} for a timestamped directory next to the source
 */
public record TabulationRequest(Path source, Path outputDir) {

    public TabulationRequest {
        Objects.requireNonNull(source, "source");
    }

    public static TabulationRequest of(Path source) {
        return new TabulationRequest(source, null);
    }
}
