package io.logtabulator.parser;

import org.springframework.util.StringUtils;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Claims lines that start with a fixed prefix followed by {@code key=value} pairs,
 * e.g. {@code INFO a=2,b=x}. Values are kept as text.
 */
public class KeyValueLogParser implements LogParser {

    public static final String DEFAULT_PAIR_SEPARATOR = "[,\\s]+";

    private static final Pattern PAIR = Pattern.compile("^([A-Za-z0-9_.@-]+)=(.*)$", Pattern.DOTALL);

    private final String shortName;
    private final String prefix;
    private final Pattern pairSeparator;
    private final String levelField;

    public KeyValueLogParser(String shortName, String prefix) {
        this(shortName, prefix, DEFAULT_PAIR_SEPARATOR, null);
    }

    public KeyValueLogParser(String shortName, String prefix, String pairSeparator, String levelField) {
        this.shortName = Objects.requireNonNull(shortName, "shortName");
        this.prefix = prefix == null ? "" : prefix;
        this.pairSeparator = Pattern.compile(StringUtils.hasLength(pairSeparator) ? pairSeparator : DEFAULT_PAIR_SEPARATOR);
        this.levelField = StringUtils.hasText(levelField) ? levelField : null;
    }

    @Override
    public String shortName() {
        return shortName;
    }

    @Override
    public Optional<ParsedLogRecord> tryParse(String line) {
        if (line == null || !line.startsWith(prefix)) return Optional.empty();
        String body = line.substring(prefix.length()).strip();
        if (body.isEmpty()) return Optional.empty();

        Map<String, Object> fields = new LinkedHashMap<>();
        for (String token : pairSeparator.split(body)) {
            Matcher matcher = PAIR.matcher(token);
            if (matcher.matches()) {
                fields.putIfAbsent(matcher.group(1), cleanToken(matcher.group(2)));
            }
        }
        if (fields.isEmpty()) return Optional.empty();

        if (levelField != null && StringUtils.hasText(prefix)) {
            Map<String, Object> withLevel = new LinkedHashMap<>();
            withLevel.put(levelField, prefix.strip());
            fields.forEach(withLevel::putIfAbsent);
            fields = withLevel;
        }
        return Optional.of(new ParsedLogRecord(fields));
    }

    static String cleanToken(String raw) {
        String trimmed = raw.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }
}
