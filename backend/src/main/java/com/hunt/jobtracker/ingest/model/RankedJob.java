package com.hunt.jobtracker.ingest.model;

public record RankedJob(StoredJob job, EmployerStatus employerStatus, double score) {
}
