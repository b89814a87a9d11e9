package io.logtabulator.table;

import java.nio.file.Path;

public interface TableExporter {

    /**
     * Writes the header row followed by one line per table row. The header is written even for an empty table.
     */
    void export(Table table, Path target);

    /**
     * File extension of exported tables, without the leading dot.
     */
    String extension();
}
