package com.example.pricing_import.loader;

/**
 * No data rows remain after header detection.
 */
public class EmptyFileException extends RuntimeException {

    public EmptyFileException(String message) {
        super(message);
    }
}
