package io.logtabulator.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyValueLogParserTest {

    private KeyValueLogParser parser;

    @BeforeEach
    void setUp() {
        parser = new KeyValueLogParser("info", "INFO ");
    }

    @Test
    void extractsCommaSeparatedPairs() {
        ParsedLogRecord record = parser.tryParse("INFO a=2,b=x").orElseThrow();

        assertThat(record.fields()).containsExactly(entry("a", "2"), entry("b", "x"));
    }

    @Test
    void rejectsLinesWithoutPrefix() {
        assertThat(parser.tryParse("GARBAGE")).isEmpty();
        assertThat(parser.tryParse("WARN a=1")).isEmpty();
        assertThat(parser.tryParse("INFOa=1")).isEmpty();
    }

    @Test
    void rejectsLinesWithoutAnyPair() {
        assertThat(parser.tryParse("INFO server started")).isEmpty();
        assertThat(parser.tryParse("INFO ")).isEmpty();
    }

    @Test
    void ignoresFreeTextTokensAndKeepsFirstValueOfRepeatedKey() {
        ParsedLogRecord record = parser.tryParse("INFO request done status=200 status=500 user='bob'").orElseThrow();

        assertThat(record.get("status")).isEqualTo("200");
        assertThat(record.get("user")).isEqualTo("bob");
        assertThat(record.keys()).containsExactly("status", "user");
    }

    @Test
    void storesPrefixAsLevelFieldWhenConfigured() {
        KeyValueLogParser levelled = new KeyValueLogParser("kv", "WARN ", null, "_level");

        ParsedLogRecord record = levelled.tryParse("WARN disk=sda1 used=93%").orElseThrow();

        assertThat(record.keys()).containsExactly("_level", "disk", "used");
        assertThat(record.get("_level")).isEqualTo("WARN");
    }

    @Test
    void emptyPrefixAcceptsAnyLineWithPairs() {
        KeyValueLogParser any = new KeyValueLogParser("any", "", "\\s+", null);

        assertThat(any.tryParse("x=1 y=2")).isPresent();
        assertThat(any.tryParse("nothing here")).isEmpty();
    }
}
