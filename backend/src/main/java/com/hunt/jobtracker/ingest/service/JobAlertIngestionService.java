package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import com.hunt.jobtracker.ingest.email.JobAlertEmailParser;
import com.hunt.jobtracker.ingest.http.JobAlertSource;
import com.hunt.jobtracker.ingest.model.AdmissionResult;
import com.hunt.jobtracker.ingest.model.IngestionSummary;
import com.hunt.jobtracker.ingest.model.JobAlertEmail;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class JobAlertIngestionService {
    private static final Logger log = LoggerFactory.getLogger(JobAlertIngestionService.class);

    private final JobAlertEmailParser parser;
    private final JobIntakeService intakeService;
    private final HuntProperties properties;

    public JobAlertIngestionService(
        JobAlertEmailParser parser,
        JobIntakeService intakeService,
        HuntProperties properties
    ) {
        this.parser = parser;
        this.intakeService = intakeService;
        this.properties = properties;
    }

    public IngestionSummary ingest(JobAlertSource source) {
        return ingest(source, properties.getIngest().isDryRun());
    }

    /**
     * Parses every alert the source returns and admits the postings found. A message id seen
     * twice is processed once. An email that cannot be parsed counts as an error and the run
     * moves on; in a dry run novel postings are counted as added but not stored.
     */
    public IngestionSummary ingest(JobAlertSource source, boolean dryRun) {
        List<JobAlertEmail> emails;
        try {
            emails = source.fetchAlerts();
        } catch (IOException e) {
            log.warn("Failed to fetch job alert emails: {}", e.getMessage());
            return new IngestionSummary(0, 0, 0, 1);
        }

        Set<String> seenMessageIds = new HashSet<>();
        int emailsFound = 0;
        int added = 0;
        int duplicates = 0;
        int errors = 0;
        for (JobAlertEmail email : emails) {
            if (email.messageId() != null && !seenMessageIds.add(email.messageId())) {
                continue;
            }
            emailsFound++;
            List<ParsedJob> jobs;
            try {
                jobs = parser.parse(email);
            } catch (RuntimeException e) {
                log.warn("Failed to parse email '{}' from {}: {}", email.subject(), email.from(), e.getMessage());
                errors++;
                continue;
            }
            for (ParsedJob job : jobs) {
                if (!job.hasTitle()) {
                    continue;
                }
                AdmissionResult result = intakeService.admit(job, dryRun);
                switch (result.status()) {
                    case ADDED, DRY_RUN -> added++;
                    case DUPLICATE -> duplicates++;
                }
            }
        }
        log.info(
            "Job alert ingestion{}: emails={}, added={}, duplicates={}, errors={}",
            dryRun ? " [dry-run]" : "",
            emailsFound,
            added,
            duplicates,
            errors
        );
        return new IngestionSummary(emailsFound, added, duplicates, errors);
    }
}
