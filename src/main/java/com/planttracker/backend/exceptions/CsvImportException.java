package com.planttracker.backend.exceptions;

/**
 * Structural failure of an import: the file cannot be read, is empty, or none of its
 * columns belong to the requested import type. Fatal to the whole job.
 */
public class CsvImportException extends RuntimeException {

    public CsvImportException(String message) {
        super(message);
    }

    public CsvImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
