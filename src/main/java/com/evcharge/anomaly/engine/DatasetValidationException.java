package com.evcharge.anomaly.engine;

import java.util.List;

/**
 * Raised when an upload cannot be processed at all, e.g. identity or time columns are missing.
 */
public class DatasetValidationException extends IllegalArgumentException {

    private final List<String> missingColumns;

    public DatasetValidationException(String message) {
        this(message, List.of());
    }

    public DatasetValidationException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public DatasetValidationException(String message, Throwable cause) {
        super(message, cause);
        this.missingColumns = List.of();
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
