package io.logtabulator.parser;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonLogParserTest {

    private JsonLogParser parser;

    @BeforeEach
    void setUp() {
        parser = new JsonLogParser("json", new ObjectMapper());
    }

    @Test
    void keepsScalarTypes() {
        ParsedLogRecord record = parser
                .tryParse("{\"@message\":\"done\",\"status\":201,\"ratio\":0.5,\"ok\":true,\"user\":null}")
                .orElseThrow();

        assertThat(record.get("@message")).isEqualTo("done");
        assertThat(record.get("status")).isEqualTo(201);
        assertThat(record.get("ratio")).isEqualTo(0.5);
        assertThat(record.get("ok")).isEqualTo(true);
        assertThat(record.keys()).contains("user");
        assertThat(record.get("user")).isNull();
    }

    @Test
    void flattensNestedObjectsAndKeepsArraysAsJson() {
        String json = """
                {"http":{"method":"GET","route":{"path":"/orders"}},"tags":["checkout","eu"]}
                """;

        ParsedLogRecord record = parser.tryParse(json).orElseThrow();

        assertThat(record.keys()).containsExactly("http.method", "http.route.path", "tags");
        assertThat(record.get("http.route.path")).isEqualTo("/orders");
        assertThat(record.get("tags")).isEqualTo("[\"checkout\",\"eu\"]");
    }

    @Test
    void leavesObjectsWithoutUsableFieldsUnclaimed() {
        assertThat(parser.tryParse("{}")).isEmpty();
        assertThat(parser.tryParse("{\"nested\":{}}")).isPresent();
        assertThat(parser.tryParse("{\"\":1}")).isEmpty();
    }

    @Test
    void leavesObjectsWithMultiLineKeysUnclaimed() {
        assertThat(parser.tryParse("{\"first\\nsecond\":1}")).isEmpty();
        assertThat(parser.tryParse("{\"ok\":1,\"bad\\r\":2}")).isEmpty();
    }

    @Test
    void rejectsNonObjectsAndBrokenJson() {
        assertThat(parser.tryParse("[1,2,3]")).isEmpty();
        assertThat(parser.tryParse("{\"message\":")).isEmpty();
        assertThat(parser.tryParse("INFO a=1")).isEmpty();
        assertThat(parser.tryParse("   ")).isEmpty();
    }
}
