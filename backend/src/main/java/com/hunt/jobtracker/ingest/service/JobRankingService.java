package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.model.EmployerStatus;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.RankedJob;
import com.hunt.jobtracker.ingest.model.RankingCandidate;
import com.hunt.jobtracker.ingest.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Service
public class JobRankingService {
    private static final Logger log = LoggerFactory.getLogger(JobRankingService.class);

    private final JobRecordStore store;
    private final JobScorer scorer;

    public JobRankingService(JobRecordStore store, JobScorer scorer) {
        this.store = store;
        this.scorer = scorer;
    }

    /**
     * Open jobs, best first. Equal scores keep insertion order. A non-positive limit means no
     * limit.
     */
    public List<RankedJob> rank(int limit) {
        List<RankedJob> ranked = store.findRankingCandidates().stream()
            .filter(candidate -> candidate.job().status().isOpen())
            .map(this::toRanked)
            .sorted(Comparator.comparingDouble(RankedJob::score).reversed())
            .limit(limit > 0 ? limit : Long.MAX_VALUE)
            .toList();
        log.debug("Ranked {} jobs (limit {})", ranked.size(), limit);
        return ranked;
    }

    public void markJob(long jobId, JobStatus status) {
        if (!store.updateStatus(jobId, status)) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Job #{} marked {}", jobId, status.code());
    }

    public void markEmployer(String employer, EmployerStatus status) {
        if (employer == null || employer.isBlank()) {
            throw new IllegalArgumentException("Employer name is required");
        }
        store.setEmployerStatus(employer, status);
    }

    public List<String> employers(EmployerStatus status) {
        return store.findEmployerNames(status);
    }

    private RankedJob toRanked(RankingCandidate candidate) {
        return new RankedJob(
            candidate.job(),
            candidate.employerStatus(),
            scorer.score(candidate.job(), candidate.employerStatus())
        );
    }
}
