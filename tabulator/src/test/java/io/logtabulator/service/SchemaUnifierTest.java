package io.logtabulator.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logtabulator.parser.KeyValueLogParser;
import io.logtabulator.parser.LogParser;
import io.logtabulator.service.dto.ChunkKeys;
import io.logtabulator.service.dto.TableSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaUnifierTest {

    @TempDir
    Path parsedDir;

    private RecordCodec codec;
    private SchemaUnifier unifier;

    @BeforeEach
    void setUp() {
        codec = new RecordCodec(new ObjectMapper());
        unifier = new SchemaUnifier(codec);
    }

    @Test
    void ordersUserFieldsFirstThenCaseInsensitively() {
        assertThat(SchemaUnifier.orderHeaders(List.of("b", "_z", "A", "_a")))
                .containsExactly("_a", "_z", "A", "b");
        assertThat(SchemaUnifier.orderHeaders(List.of("level", "Message", "_src", "id", "message")))
                .containsExactly("_src", "id", "level", "Message", "message");
    }

    @Test
    void unionsKeysAndCountsAcrossChunks() throws IOException {
        Path kvDir = Files.createDirectories(parsedDir.resolve("kv"));
        codec.writeKeys(kvDir.resolve("chunk_1.kv.keys"), new ChunkKeys(2, Set.of("a")));
        codec.writeKeys(kvDir.resolve("chunk_2.kv.keys"), new ChunkKeys(0, Set.of()));
        codec.writeKeys(kvDir.resolve("chunk_10.kv.keys"), new ChunkKeys(1, Set.of("b", "_level")));
        List<LogParser> parsers = List.of(new KeyValueLogParser("kv", "INFO "), new KeyValueLogParser("none", "X "));

        Map<String, TableSchema> schemas = unifier.unify(parsedDir, parsers);

        assertThat(schemas).containsOnlyKeys("kv", "none");
        assertThat(schemas.get("kv").headers()).containsExactly("_level", "a", "b");
        assertThat(schemas.get("kv").recordCount()).isEqualTo(3);
        assertThat(schemas.get("none").headers()).isEmpty();
        assertThat(schemas.get("none").hasRecords()).isFalse();
    }

    @Test
    void keepsParserPriorityOrder() {
        List<LogParser> parsers = List.of(
                new KeyValueLogParser("z", "Z "), new KeyValueLogParser("a", "A "), new KeyValueLogParser("m", "M "));

        assertThat(unifier.unify(parsedDir, parsers).keySet()).containsExactly("z", "a", "m");
    }
}
