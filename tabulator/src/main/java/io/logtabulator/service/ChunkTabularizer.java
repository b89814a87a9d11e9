package io.logtabulator.service;

import io.logtabulator.parser.ParsedLogRecord;
import io.logtabulator.service.dto.TableSchema;
import io.logtabulator.service.dto.TabularizeTask;
import io.logtabulator.table.Table;
import io.logtabulator.table.TableExporter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkTabularizer {

    private final RecordCodec codec;

    /**
     * One task per records file of every parser that matched at least one line. Parsers without any
     * match get no tables at all.
     */
    public List<TabularizeTask> plan(Path parsedDir, Path destDir, Collection<TableSchema> schemas) {
        List<TabularizeTask> tasks = new ArrayList<>();
        for (TableSchema schema : schemas) {
            if (!schema.hasRecords()) {
                log.info("Parser '{}' did not match any line, no table will be produced", schema.parserName());
                continue;
            }
            Path parserDir = parsedDir.resolve(schema.parserName());
            for (Path recordsFile : ChunkFiles.listSorted(parserDir, ChunkFiles.RECORDS_EXT)) {
                tasks.add(new TabularizeTask(schema, recordsFile, destDir.resolve(schema.parserName())));
            }
        }
        return tasks;
    }

    public Path tabularizeChunk(TabularizeTask task, TableExporter exporter) {
        List<ParsedLogRecord> records = codec.readRecords(task.recordsFile());
        Table table = Table.render(task.schema().headers(), records);
        try {
            Files.createDirectories(task.destDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + task.destDir(), e);
        }
        Path target = task.destDir().resolve(ChunkFiles.stem(task.recordsFile()) + "." + exporter.extension());
        exporter.export(table, target);
        return target;
    }
}
