package io.logtabulator.service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Concatenates chunk outputs in ascending chunk id order into the final files of a run.
 */
@Slf4j
@Component
public class ChunkMerger {

    public Path mergeUnparsed(Path parsedDir, Path outputDir, String sourceBaseName) {
        List<Path> chunks = ChunkFiles.listSorted(parsedDir.resolve(ChunkFiles.UNPARSED_NAME), "");
        if (chunks.isEmpty()) {
            throw new PipelineException("No unparsed chunk files found under " + parsedDir);
        }
        Path target = outputDir.resolve(sourceBaseName + "." + ChunkFiles.UNPARSED_NAME
                + sourceExtension(chunks.get(0)));
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW)) {
            for (int i = 0; i < chunks.size(); i++) {
                log.info("(file 1/1) Merging file chunk {} of {}", i + 1, chunks.size());
                Files.copy(chunks.get(i), out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to merge unparsed lines into " + target, e);
        }
        return target;
    }

    /**
     * Merges the chunk tables of one parser, keeping the header line of the first table only.
     *
     * @return the merged table, or empty when the parser has no chunk tables
     */
    public Optional<Path> mergeTables(Path tabularizedDir, Path outputDir, String sourceBaseName,
                                      String parserName, int parserNo, int parserCount) {
        List<Path> tables = ChunkFiles.listSorted(tabularizedDir.resolve(parserName), "");
        if (tables.isEmpty()) {
            log.info("(file {}/{}) No tables for parser '{}', skipping merge", parserNo, parserCount, parserName);
            return Optional.empty();
        }
        Path target = outputDir.resolve(sourceBaseName + "." + parserName + ChunkFiles.extension(tables.get(0)));
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW)) {
            for (int i = 0; i < tables.size(); i++) {
                log.info("(file {}/{}) Merging file chunk {} of {}", parserNo, parserCount, i + 1, tables.size());
                try (InputStream in = new BufferedInputStream(Files.newInputStream(tables.get(i)))) {
                    if (i > 0) {
                        skipLine(in);
                    }
                    in.transferTo(out);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to merge tables into " + target, e);
        }
        return Optional.of(target);
    }

    // chunk_N.na<ext>: chunk names hold no dot, so the source extension follows the first ".na"
    private static String sourceExtension(Path unparsedChunk) {
        String name = unparsedChunk.getFileName().toString();
        return name.substring(name.indexOf('.') + 1 + ChunkFiles.UNPARSED_NAME.length());
    }

    private static void skipLine(InputStream in) throws IOException {
        int b = in.read();
        while (b != -1 && b != '\n') {
            b = in.read();
        }
    }
}
