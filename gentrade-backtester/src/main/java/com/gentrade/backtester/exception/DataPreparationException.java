package com.gentrade.backtester.exception;

import java.util.List;

/**
 * Market data required by a strategy could not be made available.
 */
public class DataPreparationException extends RuntimeException {

    private final List<String> missingFiles;

    public DataPreparationException(String message) {
        this(message, List.of(), null);
    }

    public DataPreparationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public DataPreparationException(String message, List<String> missingFiles, Throwable cause) {
        super(message, cause);
        this.missingFiles = missingFiles != null ? List.copyOf(missingFiles) : List.of();
    }

    public List<String> getMissingFiles() {
        return missingFiles;
    }
}
