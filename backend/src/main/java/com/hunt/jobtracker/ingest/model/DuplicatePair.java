package com.hunt.jobtracker.ingest.model;

public record DuplicatePair(
    long earlierId,
    long duplicateId,
    String reason
) {
}
