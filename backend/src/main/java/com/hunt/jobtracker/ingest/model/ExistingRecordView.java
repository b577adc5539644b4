package com.hunt.jobtracker.ingest.model;

public record ExistingRecordView(
    long id,
    String title,
    String employer,
    String url
) {
}
