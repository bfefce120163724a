package com.planttracker.backend.exceptions;

public class ImportAccessDeniedException extends RuntimeException {

    public ImportAccessDeniedException(String jobId) {
        super("Import " + jobId + " belongs to another user");
    }
}
