package io.logtabulator.table;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports tables as delimiter separated text (tab separated by default). Values are quoted only when they
 * contain the separator, the quote character or a line break.
 * <p>
 * Every line carries exactly one cell per header; missing values are written as empty cells.
 */
@Slf4j
public class DelimitedTableExporter implements TableExporter {

    public static final char TAB = '\t';

    private final CsvMapper mapper;
    private final char separator;
    private final String extension;

    public DelimitedTableExporter(char separator, String extension) {
        this.mapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .disable(CsvGenerator.Feature.OMIT_MISSING_TAIL_COLUMNS)
                .build();
        this.separator = separator;
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    public static DelimitedTableExporter tsv() {
        return new DelimitedTableExporter(TAB, "tsv");
    }

    @Override
    public void export(Table table, Path target) {
        if (table.headers().isEmpty()) {
            throw new IllegalStateException("Cannot export a table without columns to " + target);
        }
        log.debug("Creating file: {}", target);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter writer = mapper.writer(schemaOf(table)).writeValues(out)) {
            writer.write(table.headers());
            for (List<Object> row : table.rows()) {
                writer.write(renderCells(row));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export table to " + target, e);
        }
    }

    @Override
    public String extension() {
        return extension;
    }

    // header line is written as the first row so that an empty table still gets one
    private CsvSchema schemaOf(Table table) {
        return CsvSchema.builder()
                .addColumns(table.headers(), CsvSchema.ColumnType.STRING)
                .setUseHeader(false)
                .setColumnSeparator(separator)
                .setLineSeparator("\n")
                .setNullValue("")
                .build();
    }

    private static List<String> renderCells(List<Object> row) {
        List<String> cells = new ArrayList<>(row.size());
        for (Object cell : row) {
            cells.add(cell == null ? "" : String.valueOf(cell));
        }
        return cells;
    }
}
