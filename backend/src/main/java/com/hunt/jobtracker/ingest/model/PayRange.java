package com.hunt.jobtracker.ingest.model;

public record PayRange(Long min, Long max) {
    public static final PayRange EMPTY = new PayRange(null, null);

    public PayRange {
        if (min != null && max != null && min > max) {
            Long swap = min;
            min = max;
            max = swap;
        }
    }

    public boolean isEmpty() {
        return min == null && max == null;
    }
}
