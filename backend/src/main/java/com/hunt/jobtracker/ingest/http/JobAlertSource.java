package com.hunt.jobtracker.ingest.http;

import com.hunt.jobtracker.ingest.model.JobAlertEmail;

import java.io.IOException;
import java.util.List;

/**
 * Mailbox access for job-alert emails. Implementations return messages newest first; the
 * same message may be returned by more than one query.
 */
public interface JobAlertSource {
    List<JobAlertEmail> fetchAlerts() throws IOException;
}
