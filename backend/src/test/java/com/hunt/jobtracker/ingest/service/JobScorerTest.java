package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.model.EmployerStatus;
import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.StoredJob;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobScorerTest {
    private final JobScorer scorer = new JobScorer();

    @Test
    void maxPayBonusIsCapped() {
        assertEquals(50 + 15 + 5, scorer.score(job(JobStatus.NEW, 100_000L, 150_000L), EmployerStatus.OK), 1e-9);
        assertEquals(50 + 30 + 5, scorer.score(job(JobStatus.NEW, null, 900_000L), EmployerStatus.OK), 1e-9);
    }

    @Test
    void minPayUsedOnlyWithoutMax() {
        assertEquals(50 + 8 + 5, scorer.score(job(JobStatus.NEW, 120_000L, null), EmployerStatus.OK), 1e-9);
        assertEquals(50 + 20 + 5, scorer.score(job(JobStatus.NEW, 600_000L, null), EmployerStatus.OK), 1e-9);
    }

    @Test
    void statusBonusAndEmployerPenalty() {
        assertEquals(60, scorer.score(job(JobStatus.REVIEWING, null, null), EmployerStatus.OK), 1e-9);
        assertEquals(50, scorer.score(job(JobStatus.APPLIED, null, null), EmployerStatus.OK), 1e-9);
        assertEquals(35, scorer.score(job(JobStatus.NEW, null, null), EmployerStatus.YUCK), 1e-9);
    }

    @Test
    void neverEmployerFloorsAtZero() {
        assertEquals(0, scorer.score(job(JobStatus.REVIEWING, null, 200_000L), EmployerStatus.NEVER), 1e-9);
    }

    private static StoredJob job(JobStatus status, Long payMin, Long payMax) {
        return new StoredJob(1L, "Backend Engineer", "Globex", null, JobSource.MANUAL, status,
            payMin, payMax, null, false, "", null, null);
    }
}
