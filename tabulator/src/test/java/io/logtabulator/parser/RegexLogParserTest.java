package io.logtabulator.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RegexLogParserTest {

    private static final String ACCESS_LOG =
            "(?<host>\\S+) \\S+ \\S+ \\[(?<time>[^\\]]+)\\] \"(?<method>[A-Z]+) (?<path>\\S+)[^\"]*\" (?<status>\\d{3})(?: (?<bytes>\\d+))?";

    @Test
    void mapsNamedGroupsToFields() {
        RegexLogParser parser = new RegexLogParser("access", ACCESS_LOG);

        ParsedLogRecord record = parser
                .tryParse("10.0.0.1 - - [10/Oct/2024:13:55:36 +0000] \"GET /index.html HTTP/1.1\" 200 2326")
                .orElseThrow();

        assertThat(parser.groupNames()).containsExactly("host", "time", "method", "path", "status", "bytes");
        assertThat(record.get("host")).isEqualTo("10.0.0.1");
        assertThat(record.get("method")).isEqualTo("GET");
        assertThat(record.get("status")).isEqualTo("200");
        assertThat(record.get("bytes")).isEqualTo("2326");
    }

    @Test
    void unmatchedOptionalGroupBecomesNull() {
        RegexLogParser parser = new RegexLogParser("access", ACCESS_LOG);

        ParsedLogRecord record = parser
                .tryParse("10.0.0.1 - - [10/Oct/2024:13:55:36 +0000] \"GET / HTTP/1.1\" 304")
                .orElseThrow();

        assertThat(record.keys()).contains("bytes");
        assertThat(record.get("bytes")).isNull();
    }

    @Test
    void requiresFullMatch() {
        RegexLogParser parser = new RegexLogParser("num", "(?<n>\\d+)");

        assertThat(parser.tryParse("123")).isPresent();
        assertThat(parser.tryParse("123 apples")).isEmpty();
    }

    @Test
    void rejectsPatternWithoutNamedGroups() {
        assertThatThrownBy(() -> new RegexLogParser("plain", "\\d+"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no named groups");
    }
}
