package com.planttracker.backend.exceptions;

/**
 * The catalog store cannot be reached at all (connection refused, pool exhausted, ...).
 * Unlike a failed insert for one row, this fails the running import job.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
