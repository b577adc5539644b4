package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import com.hunt.jobtracker.ingest.email.JobAlertEmailParser;
import com.hunt.jobtracker.ingest.http.JobAlertSource;
import com.hunt.jobtracker.ingest.model.AdmissionResult;
import com.hunt.jobtracker.ingest.model.AdmissionStatus;
import com.hunt.jobtracker.ingest.model.IngestionSummary;
import com.hunt.jobtracker.ingest.model.JobAlertEmail;
import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobAlertIngestionServiceTest {

    @Mock
    private JobAlertEmailParser parser;
    @Mock
    private JobIntakeService intakeService;

    private HuntProperties properties;
    private JobAlertIngestionService service;

    @BeforeEach
    void setUp() {
        properties = new HuntProperties();
        service = new JobAlertIngestionService(parser, intakeService, properties);
    }

    @Test
    void talliesJobsAndKeepsGoingAfterBadEmail() {
        JobAlertEmail first = email("m1");
        JobAlertEmail repeat = email("m1");
        JobAlertEmail broken = email("m2");
        ParsedJob fresh = job("Backend Engineer");
        ParsedJob known = job("Data Engineer");
        when(parser.parse(first)).thenReturn(List.of(fresh, known));
        when(parser.parse(broken)).thenThrow(new IllegalStateException("unparseable body"));
        when(intakeService.admit(fresh, false)).thenReturn(new AdmissionResult(AdmissionStatus.ADDED, 10L, fresh));
        when(intakeService.admit(known, false)).thenReturn(new AdmissionResult(AdmissionStatus.DUPLICATE, 3L, known));

        IngestionSummary summary = service.ingest(() -> List.of(first, repeat, broken), false);

        assertThat(summary).isEqualTo(new IngestionSummary(2, 1, 1, 1));
        verify(parser, times(1)).parse(first);
    }

    @Test
    void dryRunFromPropertiesCountsWouldBeAdditions() {
        properties.getIngest().setDryRun(true);
        JobAlertEmail alert = email("m1");
        ParsedJob fresh = job("Backend Engineer");
        when(parser.parse(alert)).thenReturn(List.of(fresh));
        when(intakeService.admit(fresh, true)).thenReturn(new AdmissionResult(AdmissionStatus.DRY_RUN, null, fresh));

        IngestionSummary summary = service.ingest(() -> List.of(alert));

        assertThat(summary.jobsAdded()).isEqualTo(1);
    }

    @Test
    void sourceFailureIsCountedAsError() {
        JobAlertSource source = () -> {
            throw new IOException("mailbox unavailable");
        };

        IngestionSummary summary = service.ingest(source, false);

        assertThat(summary).isEqualTo(new IngestionSummary(0, 0, 0, 1));
        verify(intakeService, never()).admit(any(), anyBoolean());
    }

    private static JobAlertEmail email(String messageId) {
        return new JobAlertEmail(messageId, "alerts@dice.com", "Jobs", "Mon, 5 Jan 2026 09:00:00 +0000", "<p>body</p>");
    }

    private static ParsedJob job(String title) {
        return new ParsedJob(title, "Globex", null, null, null, null, null, false, JobSource.EMAIL_GENERIC, "");
    }
}
