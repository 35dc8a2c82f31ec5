package com.trust.network.export;

/**
 * Thrown when the result artifacts cannot be written. A failed export leaves the
 * artifacts that were in the directory before it untouched.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
