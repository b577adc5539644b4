package com.hunt.jobtracker.ingest.model;

import java.time.Instant;

public record StoredJob(
    long id,
    String title,
    String employer,
    String url,
    JobSource source,
    JobStatus status,
    Long payMin,
    Long payMax,
    String jobCode,
    boolean noLongerAccepting,
    String rawText,
    Instant createdAt,
    Instant updatedAt
) {
    public ExistingRecordView toView() {
        return new ExistingRecordView(id, title, employer, url);
    }
}
