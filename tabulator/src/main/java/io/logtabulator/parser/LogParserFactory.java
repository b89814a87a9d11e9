package io.logtabulator.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logtabulator.config.PipelineProperties.ParserDefinition;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class LogParserFactory {

    private final ObjectMapper objectMapper;

    public List<LogParser> create(List<ParserDefinition> definitions) {
        List<LogParser> parsers = new ArrayList<>();
        for (ParserDefinition definition : definitions) {
            LogParser parser = create(definition);
            log.info("Registered parser #{}: {} ({})", parsers.size() + 1, parser.shortName(), definition.getType());
            parsers.add(parser);
        }
        return parsers;
    }

    public LogParser create(ParserDefinition definition) {
        String name = definition.getName();
        if (!StringUtils.hasText(name)) {
            throw new IllegalStateException("Parser definition without a name");
        }
        if (definition.getType() == null) {
            throw new IllegalStateException("Parser '" + name + "' has no type");
        }
        return switch (definition.getType()) {
            case KEY_VALUE -> new KeyValueLogParser(name, definition.getPrefix(),
                    definition.getPairSeparator(), definition.getLevelField());
            case REGEX -> regex(name, definition.getPattern());
            case JSON -> new JsonLogParser(name, objectMapper);
            case PLAIN_TEXT -> new PlainTextLogParser(name);
        };
    }

    private LogParser regex(String name, String pattern) {
        if (!StringUtils.hasText(pattern)) {
            throw new IllegalStateException("Regex parser '" + name + "' requires a pattern");
        }
        try {
            return new RegexLogParser(name, pattern);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid pattern for parser '" + name + "': " + e.getMessage(), e);
        }
    }
}
