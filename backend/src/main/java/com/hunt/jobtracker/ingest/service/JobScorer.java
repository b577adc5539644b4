package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.model.EmployerStatus;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.StoredJob;
import org.springframework.stereotype.Component;

/**
 * Scores a job for the "what to look at next" list. Better pay and a job already under review
 * push a posting up; a disliked employer pushes it down. Scores never go below zero.
 */
@Component
public class JobScorer {
    static final double BASE_SCORE = 50.0;
    static final double MAX_PAY_BONUS = 30.0;
    static final double MIN_ONLY_PAY_BONUS = 20.0;
    static final double YUCK_PENALTY = 20.0;
    static final double NEVER_PENALTY = 100.0;
    static final double REVIEWING_BONUS = 10.0;
    static final double NEW_BONUS = 5.0;

    public double score(StoredJob job, EmployerStatus employerStatus) {
        double score = BASE_SCORE;

        if (job.payMax() != null) {
            score += Math.min(job.payMax() / 10_000.0, MAX_PAY_BONUS);
        } else if (job.payMin() != null) {
            score += Math.min(job.payMin() / 15_000.0, MIN_ONLY_PAY_BONUS);
        }

        if (employerStatus == EmployerStatus.YUCK) {
            score -= YUCK_PENALTY;
        } else if (employerStatus == EmployerStatus.NEVER) {
            score -= NEVER_PENALTY;
        }

        if (job.status() == JobStatus.REVIEWING) {
            score += REVIEWING_BONUS;
        } else if (job.status() == JobStatus.NEW) {
            score += NEW_BONUS;
        }

        return Math.max(score, 0.0);
    }
}
