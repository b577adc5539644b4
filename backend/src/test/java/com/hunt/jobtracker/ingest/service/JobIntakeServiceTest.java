package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.dedup.DuplicateDetector;
import com.hunt.jobtracker.ingest.model.AdmissionResult;
import com.hunt.jobtracker.ingest.model.AdmissionStatus;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JobIntakeServiceTest {
    private InMemoryJobRecordStore store;
    private JobIntakeService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobRecordStore();
        service = new JobIntakeService(store, new DuplicateDetector());
    }

    @Test
    void addsNovelJob() {
        AdmissionResult result = service.admit(job("Backend Engineer", "Globex", "https://example.com/1"), false);

        assertEquals(AdmissionStatus.ADDED, result.status());
        assertThat(store.ids()).containsExactly(result.jobId());
    }

    @Test
    void reportsDuplicateOfStoredRecord() {
        long existing = store.add("Senior Software Engineer", "Wiraa", null);

        AdmissionResult result = service.admit(job("Sr. Software Engineer", "WIRAA", null), false);

        assertEquals(AdmissionStatus.DUPLICATE, result.status());
        assertEquals(existing, result.jobId());
        assertThat(store.ids()).containsExactly(existing);
    }

    @Test
    void sameUrlAtOtherEmployerIsDuplicate() {
        long existing = store.add("Office Manager", "Acme", "https://example.com/jobs/9");

        AdmissionResult result = service.admit(job("Staff Engineer", "Initech", "https://example.com/jobs/9"), false);

        assertEquals(AdmissionStatus.DUPLICATE, result.status());
        assertEquals(existing, result.jobId());
    }

    @Test
    void secondOfTwoNearIdenticalCandidatesIsDuplicate() {
        AdmissionResult first = service.admit(job("Platform Engineer", "Hooli", null), false);
        AdmissionResult second = service.admit(job("Platform Engineer ", "hooli", null), false);

        assertEquals(AdmissionStatus.ADDED, first.status());
        assertEquals(AdmissionStatus.DUPLICATE, second.status());
        assertEquals(first.jobId(), second.jobId());
    }

    @Test
    void dryRunStoresNothing() {
        AdmissionResult result = service.admit(job("Data Engineer", "Globex", null), true);

        assertEquals(AdmissionStatus.DRY_RUN, result.status());
        assertThat(result.jobId()).isNull();
        assertThat(store.ids()).isEmpty();
    }

    @Test
    void blankTitleIsRejected() {
        assertThatThrownBy(() -> service.admit(job("  ", "Globex", null), false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ParsedJob job(String title, String employer, String url) {
        return new ParsedJob(title, employer, url, null, null, null, null, false, null, "");
    }
}
