package com.hunt.jobtracker.ingest.model;

public record JobAlertEmail(
    String messageId,
    String from,
    String subject,
    String date,
    String body
) {
}
