package com.hunt.jobtracker.ingest.model;

public record AdmissionResult(
    AdmissionStatus status,
    Long jobId,
    ParsedJob job
) {
}
