package io.logtabulator.service;

import java.nio.file.Path;

/**
 * A records or keys file that does not follow the expected format.
 */
public class RecordFormatException extends PipelineException {

    public RecordFormatException(Path file, String message) {
        super(file + ": " + message);
    }

    public RecordFormatException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
    }
}
