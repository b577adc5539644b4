package com.hunt.jobtracker.ingest.model;

public record IngestionSummary(
    int emailsFound,
    int jobsAdded,
    int duplicates,
    int errors
) {
}
