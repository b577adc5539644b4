package com.hunt.jobtracker.ingest.service;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(long jobId) {
        super("Job not found: " + jobId);
    }
}
