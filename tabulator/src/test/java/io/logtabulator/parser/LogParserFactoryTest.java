package io.logtabulator.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logtabulator.config.PipelineProperties.ParserDefinition;
import io.logtabulator.config.PipelineProperties.ParserType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogParserFactoryTest {

    private LogParserFactory factory;

    @BeforeEach
    void setUp() {
        factory = new LogParserFactory(new ObjectMapper());
    }

    @Test
    void createsParsersInDefinitionOrder() {
        List<LogParser> parsers = factory.create(List.of(
                definition("json", ParserType.JSON),
                definition("text", ParserType.PLAIN_TEXT),
                keyValue("kv", "INFO "),
                regex("num", "(?<n>\\d+)")));

        assertThat(parsers).extracting(LogParser::shortName).containsExactly("json", "text", "kv", "num");
        assertThat(parsers).extracting(parser -> parser.getClass().getSimpleName()).containsExactly(
                "JsonLogParser", "PlainTextLogParser", "KeyValueLogParser", "RegexLogParser");
        assertThat(parsers.get(2).tryParse("INFO a=1")).isPresent();
    }

    @Test
    void rejectsIncompleteDefinitions() {
        assertThatThrownBy(() -> factory.create(definition(null, ParserType.JSON)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> factory.create(definition("x", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no type");
        assertThatThrownBy(() -> factory.create(regex("r", "")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires a pattern");
        assertThatThrownBy(() -> factory.create(regex("r", "(?<a>[")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid pattern");
    }

    private static ParserDefinition definition(String name, ParserType type) {
        ParserDefinition definition = new ParserDefinition();
        definition.setName(name);
        definition.setType(type);
        return definition;
    }

    private static ParserDefinition keyValue(String name, String prefix) {
        ParserDefinition definition = definition(name, ParserType.KEY_VALUE);
        definition.setPrefix(prefix);
        return definition;
    }

    private static ParserDefinition regex(String name, String pattern) {
        ParserDefinition definition = definition(name, ParserType.REGEX);
        definition.setPattern(pattern);
        return definition;
    }
}
