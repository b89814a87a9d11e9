package io.logtabulator.table;

import io.logtabulator.parser.ParsedLogRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rows rendered against a fixed list of column headers. Cells of fields a record does not carry are {@code null}.
 */
public record Table(List<String> headers, List<List<Object>> rows) {

    public Table {
        headers = List.copyOf(Objects.requireNonNull(headers, "headers"));
        Objects.requireNonNull(rows, "rows");
        for (List<Object> row : rows) {
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells, expected " + headers.size());
            }
        }
        rows = Collections.unmodifiableList(rows);
    }

    public static Table render(List<String> headers, List<ParsedLogRecord> records) {
        Set<String> columns = new HashSet<>(headers);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (ParsedLogRecord record : records) {
            for (String key : record.keys()) {
                if (!columns.contains(key)) {
                    throw new IllegalStateException("Record field '" + key + "' is not part of the table headers " + headers);
                }
            }
            List<Object> row = new ArrayList<>(headers.size());
            for (String header : headers) {
                row.add(record.get(header));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return new Table(headers, rows);
    }
}
