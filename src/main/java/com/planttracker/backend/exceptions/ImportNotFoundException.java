package com.planttracker.backend.exceptions;

/**
 * No progress entry for the job id: it never existed, was evicted after the retention
 * window, or was lost with a restart. Distinct from a job that is still processing.
 */
public class ImportNotFoundException extends RuntimeException {

    private final String jobId;

    public ImportNotFoundException(String jobId) {
        super("Import " + jobId + " is unknown or has expired");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
