package com.signalsync.shared.error;

/**
 * Base class of the configuration failures raised by the analyzer.
 */
public class SyncAnalysisException extends RuntimeException {

    public SyncAnalysisException(String message) {
        super(message);
    }
}
