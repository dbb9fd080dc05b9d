package io.evpipelines.source;

import java.io.IOException;

/**
 * Raised when a CSV file cannot be read as a header row followed by rows of the same width.
 */
public class CsvFormatException extends IOException {
    private final long lineNumber;

    public CsvFormatException(String message, long lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public CsvFormatException(String message, long lineNumber, Throwable cause) {
        super(message + " (line " + lineNumber + ")", cause);
        this.lineNumber = lineNumber;
    }

    public long lineNumber() { return lineNumber; }
}
