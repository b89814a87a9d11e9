package io.logtabulator.service.dto;

import java.util.List;

public record TableSchema(String parserName, List<String> headers, long recordCount) {

    public TableSchema {
        headers = List.copyOf(headers);
    }

    public boolean hasRecords() {
        return recordCount > 0;
    }
}
