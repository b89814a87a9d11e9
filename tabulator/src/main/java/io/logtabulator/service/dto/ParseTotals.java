package io.logtabulator.service.dto;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line counts of a whole run: lines read, lines claimed per parser (in parser order) and lines left unparsed.
 */
public record ParseTotals(long lines, Map<String, Long> matched, long unparsed) {

    public static final ParseTotals EMPTY = new ParseTotals(0, Map.of(), 0);

    public ParseTotals {
        matched = Collections.unmodifiableMap(new LinkedHashMap<>(matched));
    }

    public static ParseTotals sum(List<String> parserNames, Collection<ChunkParseSummary> chunks) {
        Map<String, Long> matched = new LinkedHashMap<>();
        parserNames.forEach(name -> matched.put(name, 0L));
        long lines = 0;
        long unparsed = 0;
        for (ChunkParseSummary chunk : chunks) {
            lines += chunk.lines();
            unparsed += chunk.unparsed();
            chunk.matched().forEach((name, count) -> matched.merge(name, count, Long::sum));
        }
        return new ParseTotals(lines, matched, unparsed);
    }
}
