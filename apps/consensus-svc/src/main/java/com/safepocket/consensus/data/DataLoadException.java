package com.safepocket.consensus.data;

/**
 * Fatal: no dataset could be produced, so no detector runs.
 */
public class DataLoadException extends RuntimeException {

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
