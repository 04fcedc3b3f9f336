package com.example.pricing_import.loader;

/**
 * The uploaded content cannot be parsed as any supported tabular format.
 */
public class UnreadableFileException extends RuntimeException {

    public UnreadableFileException(String message) {
        super(message);
    }

    public UnreadableFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
