package com.hunt.jobtracker.ingest.model;

public record JobDescription(
    String text,
    Long payMin,
    Long payMax,
    String jobCode,
    boolean noLongerAccepting
) {
    public boolean isEmpty() {
        return text == null || text.isBlank();
    }
}
