package io.logtabulator.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Pipeline configuration (app.pipeline.*).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Target size of a source file chunk. Files not larger than this are processed as a single chunk.
     */
    private DataSize chunkSize = DataSize.ofBytes(1_000_000_000L);

    /**
     * Upper bound of worker threads used by the parse and tabularize stages.
     */
    private int maxThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Remove staging directories once the next stage has consumed them.
     */
    private boolean deleteIntermediateDirs = true;

    /**
     * Accept staging directories that already exist and are not empty.
     */
    private boolean allowExistingStagingDirs = false;

    /**
     * Output directory used when none is given on the command line.
     */
    private String outputDir;

    private TableFormat table = new TableFormat();

    /**
     * Parsers in priority order: the first one that accepts a line claims it.
     */
    private List<ParserDefinition> parsers = new ArrayList<>();

    @Getter
    @Setter
    public static class TableFormat {
        private String separator = "\t";
        private String extension = "tsv";
    }

    @Getter
    @Setter
    public static class ParserDefinition {
        private String name;
        private ParserType type;
        private String prefix = "";
        private String pairSeparator;
        private String levelField;
        private String pattern;
    }

    public enum ParserType {
        KEY_VALUE,
        REGEX,
        JSON,
        PLAIN_TEXT
    }
}
