package com.hunt.jobtracker.ingest.model;

/** An open job paired with the status of its employer ({@link EmployerStatus#OK} when it has none). */
public record RankingCandidate(StoredJob job, EmployerStatus employerStatus) {
}
