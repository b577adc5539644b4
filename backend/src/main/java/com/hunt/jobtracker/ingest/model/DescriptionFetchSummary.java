package com.hunt.jobtracker.ingest.model;

import java.util.Map;

public record DescriptionFetchSummary(
    int attempted,
    int succeeded,
    int failed,
    Map<Long, String> failures
) {
}
