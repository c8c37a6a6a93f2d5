package com.polygen.core.loader;

/**
 * Raised when a data source cannot be read or does not match the table shape.
 */
public class DataLoadException extends RuntimeException {

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
