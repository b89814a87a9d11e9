package io.logtabulator.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Claims lines matching a regular expression in full; every named group becomes a field.
 */
public class RegexLogParser implements LogParser {

    private static final Pattern NAMED_GROUP = Pattern.compile("(?<!\\\\)\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final String shortName;
    private final Pattern pattern;
    private final List<String> groupNames;

    public RegexLogParser(String shortName, String regex) {
        this.shortName = Objects.requireNonNull(shortName, "shortName");
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"));
        this.groupNames = extractGroupNames(regex);
        if (groupNames.isEmpty()) {
            throw new IllegalArgumentException("Pattern of parser '" + shortName + "' declares no named groups: " + regex);
        }
    }

    @Override
    public String shortName() {
        return shortName;
    }

    public List<String> groupNames() {
        return groupNames;
    }

    @Override
    public Optional<ParsedLogRecord> tryParse(String line) {
        if (line == null) return Optional.empty();
        Matcher matcher = pattern.matcher(line);
        if (!matcher.matches()) return Optional.empty();

        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name : groupNames) {
            fields.put(name, matcher.group(name));
        }
        return Optional.of(new ParsedLogRecord(fields));
    }

    private static List<String> extractGroupNames(String regex) {
        List<String> names = new ArrayList<>();
        Matcher matcher = NAMED_GROUP.matcher(regex);
        while (matcher.find()) {
            if (!names.contains(matcher.group(1))) {
                names.add(matcher.group(1));
            }
        }
        return Collections.unmodifiableList(names);
    }
}
