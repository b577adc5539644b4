package com.hunt.jobtracker.ingest.model;

public record SplitPosting(
    String title,
    String employer,
    String location
) {
}
