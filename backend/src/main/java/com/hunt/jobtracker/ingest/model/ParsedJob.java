package com.hunt.jobtracker.ingest.model;

/**
 * A job posting produced by one extraction pass. Immutable; either stored as a new record
 * or discarded as a duplicate of an existing one.
 */
public record ParsedJob(
    String title,
    String employer,
    String url,
    String location,
    Long payMin,
    Long payMax,
    String jobCode,
    boolean noLongerAccepting,
    JobSource source,
    String rawText
) {
    public ParsedJob {
        if (payMin != null && payMax != null && payMin > payMax) {
            Long swap = payMin;
            payMin = payMax;
            payMax = swap;
        }
        rawText = rawText == null ? "" : rawText;
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
