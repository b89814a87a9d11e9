package io.logtabulator.parser;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Claims plain text lines that open with an ISO-8601 timestamp, optionally followed by a level token:
 * <pre>
 * 2024-05-13T09:15:30Z [error] apply failed status=500 req_id=abc
 * </pre>
 * Produces {@code timestamp}, {@code level}, {@code message} and one field per {@code key=value} token
 * found in the message.
 */
public class PlainTextLogParser implements LogParser {

    public static final String TIMESTAMP = "timestamp";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";

    // ISO-8601 at the start of the line (with Z or offset)
    private static final Pattern ISO_PREFIX = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?)\\s*");

    private static final Pattern LEVEL_PREFIX = Pattern.compile(
            "^(?:\\[)?(TRACE|DEBUG|INFO|WARN|WARNING|ERROR|FATAL|CRITICAL)(?:\\]|:)?(?:\\s+|$)",
            Pattern.CASE_INSENSITIVE);

    // key=value tokens in plain text logs
    private static final Pattern KV_PATTERN = Pattern.compile("(?<!\\S)([A-Za-z0-9_.-]+)=([^\\s]+)");

    private final String shortName;

    public PlainTextLogParser(String shortName) {
        this.shortName = Objects.requireNonNull(shortName, "shortName");
    }

    @Override
    public String shortName() {
        return shortName;
    }

    @Override
    public Optional<ParsedLogRecord> tryParse(String line) {
        if (line == null) return Optional.empty();
        Matcher timestamp = ISO_PREFIX.matcher(line);
        if (!timestamp.find()) return Optional.empty();

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TIMESTAMP, timestamp.group(1));

        String rest = line.substring(timestamp.end());
        Matcher level = LEVEL_PREFIX.matcher(rest);
        if (level.find()) {
            fields.put(LEVEL, level.group(1).toUpperCase(Locale.ROOT));
            rest = rest.substring(level.end());
        }
        String message = rest.strip();
        fields.put(MESSAGE, message);

        Matcher tokens = KV_PATTERN.matcher(message);
        while (tokens.find()) {
            fields.putIfAbsent(tokens.group(1), cleanToken(tokens.group(2)));
        }
        return Optional.of(new ParsedLogRecord(fields));
    }

    private String cleanToken(String raw) {
        String trimmed = raw.trim();
        while (trimmed.startsWith("\"") || trimmed.startsWith("'") || trimmed.startsWith("[") || trimmed.startsWith("{")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(",") || trimmed.endsWith(";") || trimmed.endsWith(")")
                || trimmed.endsWith("\"") || trimmed.endsWith("'") || trimmed.endsWith("]")
                || trimmed.endsWith("}")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
