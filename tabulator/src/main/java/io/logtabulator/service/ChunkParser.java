package io.logtabulator.service;

import io.logtabulator.parser.LogParser;
import io.logtabulator.parser.ParsedLogRecord;
import io.logtabulator.service.dto.ChunkKeys;
import io.logtabulator.service.dto.ChunkParseSummary;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs every line of one chunk through the parsers and persists, per parser, the claimed records and their
 * field names, plus the lines nobody claimed.
 * <pre>
 * &lt;dest&gt;/&lt;parser&gt;/chunk_N.&lt;parser&gt;.records
 * &lt;dest&gt;/&lt;parser&gt;/chunk_N.&lt;parser&gt;.keys
 * &lt;dest&gt;/na/chunk_N.na&lt;ext&gt;
 * </pre>
 * Exceptions thrown by a parser are not caught here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkParser {

    private final RecordCodec codec;

    public ChunkParseSummary parseChunk(Path chunkFile, Path destDir, List<LogParser> parsers) {
        int chunkId = ChunkFiles.chunkId(chunkFile);
        String chunkName = ChunkFiles.stem(chunkFile);

        Map<String, List<ParsedLogRecord>> records = new LinkedHashMap<>();
        Map<String, Set<String>> keys = new LinkedHashMap<>();
        for (LogParser parser : parsers) {
            records.put(parser.shortName(), new ArrayList<>());
            keys.put(parser.shortName(), new HashSet<>());
        }
        List<String> unparsed = new ArrayList<>();

        long lines = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(chunkFile), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines++;
                if (!claim(line, parsers, records, keys)) {
                    unparsed.add(line.stripTrailing());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read chunk " + chunkFile, e);
        }

        Map<String, Long> matched = new LinkedHashMap<>();
        for (LogParser parser : parsers) {
            String name = parser.shortName();
            List<ParsedLogRecord> parserRecords = records.get(name);
            persistParsed(destDir.resolve(name), chunkName, name, parserRecords, keys.get(name));
            matched.put(name, (long) parserRecords.size());
        }
        persistUnparsed(destDir.resolve(ChunkFiles.UNPARSED_NAME), chunkName, ChunkFiles.extension(chunkFile), unparsed);

        ChunkParseSummary summary = new ChunkParseSummary(chunkId, lines, matched, unparsed.size());
        log.debug("Chunk {}: {} lines, matched {}, unparsed {}", chunkId, lines, matched, unparsed.size());
        return summary;
    }

    private boolean claim(String line,
                          List<LogParser> parsers,
                          Map<String, List<ParsedLogRecord>> records,
                          Map<String, Set<String>> keys) {
        for (LogParser parser : parsers) {
            Optional<ParsedLogRecord> record = parser.tryParse(line);
            if (record.isPresent()) {
                records.get(parser.shortName()).add(record.get());
                keys.get(parser.shortName()).addAll(record.get().keys());
                return true;
            }
        }
        return false;
    }

    private void persistParsed(Path parserDir, String chunkName, String parserName,
                               List<ParsedLogRecord> records, Set<String> keys) {
        createDirectories(parserDir);
        Path recordsFile = parserDir.resolve(chunkName + "." + parserName + ChunkFiles.RECORDS_EXT);
        log.debug("Creating file: {}", recordsFile);
        codec.writeRecords(recordsFile, records);

        Path keysFile = parserDir.resolve(chunkName + "." + parserName + ChunkFiles.KEYS_EXT);
        log.debug("Creating file: {}", keysFile);
        codec.writeKeys(keysFile, new ChunkKeys(records.size(), keys));
    }

    private void persistUnparsed(Path unparsedDir, String chunkName, String extension, List<String> lines) {
        createDirectories(unparsedDir);
        Path unparsedFile = unparsedDir.resolve(chunkName + "." + ChunkFiles.UNPARSED_NAME + extension);
        log.debug("Creating file: {}", unparsedFile);
        try (BufferedWriter writer = Files.newBufferedWriter(unparsedFile, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + unparsedFile, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }
}
