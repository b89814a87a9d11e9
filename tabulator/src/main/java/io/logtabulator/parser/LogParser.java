package io.logtabulator.parser;

import java.util.Optional;

/**
 * A line-oriented extractor. Parsers are tried in their configured order and the first one
 * returning a record claims the line.
 */
public interface LogParser {

    /**
     * Short identifying name, used in intermediate and final file names.
     */
    String shortName();

    /**
     * @return the extracted record, or an empty optional when the line is not in this parser's format
     */
    Optional<ParsedLogRecord> tryParse(String line);
}
