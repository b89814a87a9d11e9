package io.logtabulator.config;

import io.logtabulator.parser.LogParserFactory;
import io.logtabulator.table.DelimitedTableExporter;
import io.logtabulator.table.TableExporter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class PipelineConfiguration {

    @Bean
    public TableExporter tableExporter(PipelineProperties properties) {
        PipelineProperties.TableFormat format = properties.getTable();
        String separator = format.getSeparator();
        if (separator == null || separator.length() != 1) {
            throw new IllegalStateException("app.pipeline.table.separator must be a single character, got '"
                    + separator + "'");
        }
        if (!StringUtils.hasText(format.getExtension())) {
            throw new IllegalStateException("app.pipeline.table.extension must not be empty");
        }
        return new DelimitedTableExporter(separator.charAt(0), format.getExtension());
    }

    @Bean
    public PipelineSettings pipelineSettings(PipelineProperties properties,
                                             LogParserFactory parserFactory,
                                             TableExporter tableExporter) {
        try {
            return new PipelineSettings(
                    parserFactory.create(properties.getParsers()),
                    properties.getChunkSize().toBytes(),
                    properties.getMaxThreads(),
                    properties.isDeleteIntermediateDirs(),
                    properties.isAllowExistingStagingDirs(),
                    tableExporter);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }
}
