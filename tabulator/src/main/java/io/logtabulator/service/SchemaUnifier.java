package io.logtabulator.service;

import io.logtabulator.parser.LogParser;
import io.logtabulator.service.dto.ChunkKeys;
import io.logtabulator.service.dto.TableSchema;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reduces the per-chunk key sets of every parser to one ordered header list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaUnifier {

    public static final String USER_FIELD_PREFIX = "_";

    /**
     * User fields (leading underscore) first, then case-insensitive alphabetical within each group.
     */
    public static final Comparator<String> HEADER_ORDER = Comparator
            .comparing((String name) -> !name.startsWith(USER_FIELD_PREFIX))
            .thenComparing(String.CASE_INSENSITIVE_ORDER)
            .thenComparing(Comparator.naturalOrder());

    private final RecordCodec codec;

    public Map<String, TableSchema> unify(Path parsedDir, List<LogParser> parsers) {
        Map<String, TableSchema> schemas = new LinkedHashMap<>();
        for (LogParser parser : parsers) {
            String name = parser.shortName();
            List<Path> keysFiles = ChunkFiles.listSorted(parsedDir.resolve(name), ChunkFiles.KEYS_EXT);

            Set<String> keys = new HashSet<>();
            long recordCount = 0;
            for (Path keysFile : keysFiles) {
                ChunkKeys chunkKeys = codec.readKeys(keysFile);
                keys.addAll(chunkKeys.keys());
                recordCount += chunkKeys.recordCount();
            }
            List<String> headers = orderHeaders(keys);
            log.info("Parser '{}': {} records, {} columns", name, recordCount, headers.size());
            schemas.put(name, new TableSchema(name, headers, recordCount));
        }
        return schemas;
    }

    public static List<String> orderHeaders(Collection<String> keys) {
        return keys.stream()
                .distinct()
                .sorted(HEADER_ORDER)
                .toList();
    }
}
