package com.hunt.jobtracker.ingest.model;

public record CleanupSummary(
    int artifactsRemoved,
    int duplicatesRemoved,
    boolean dryRun
) {
}
