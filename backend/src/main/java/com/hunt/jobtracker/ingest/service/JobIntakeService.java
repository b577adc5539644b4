package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.dedup.DuplicateDetector;
import com.hunt.jobtracker.ingest.model.AdmissionResult;
import com.hunt.jobtracker.ingest.model.AdmissionStatus;
import com.hunt.jobtracker.ingest.model.ExistingRecordView;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Admits parsed postings into the record store, one at a time. Each admission sees every
 * record stored by the admissions before it, so two near-identical candidates in the same
 * batch cannot both be judged new.
 */
@Service
public class JobIntakeService {
    private static final Logger log = LoggerFactory.getLogger(JobIntakeService.class);

    private final JobRecordStore store;
    private final DuplicateDetector duplicateDetector;

    public JobIntakeService(JobRecordStore store, DuplicateDetector duplicateDetector) {
        this.store = store;
        this.duplicateDetector = duplicateDetector;
    }

    public synchronized AdmissionResult admit(ParsedJob candidate, boolean dryRun) {
        if (candidate == null || !candidate.hasTitle()) {
            throw new IllegalArgumentException("Job title must not be blank");
        }
        OptionalLong duplicateOf = duplicateDetector.findDuplicate(candidate, comparableRecords(candidate));
        if (duplicateOf.isPresent()) {
            log.debug("'{}' at {} duplicates job {}", candidate.title(), candidate.employer(), duplicateOf.getAsLong());
            return new AdmissionResult(AdmissionStatus.DUPLICATE, duplicateOf.getAsLong(), candidate);
        }
        if (dryRun) {
            log.info("[dry-run] Would add '{}' at {}", candidate.title(), candidate.employer());
            return new AdmissionResult(AdmissionStatus.DRY_RUN, null, candidate);
        }
        long jobId = store.insert(candidate);
        log.info("Added job {} '{}' at {}", jobId, candidate.title(), candidate.employer());
        return new AdmissionResult(AdmissionStatus.ADDED, jobId, candidate);
    }

    private List<ExistingRecordView> comparableRecords(ParsedJob candidate) {
        Map<Long, ExistingRecordView> byId = new LinkedHashMap<>();
        if (candidate.url() != null) {
            for (ExistingRecordView view : store.findByUrl(candidate.url())) {
                byId.putIfAbsent(view.id(), view);
            }
        }
        if (candidate.employer() != null) {
            for (ExistingRecordView view : store.findByEmployer(candidate.employer())) {
                byId.putIfAbsent(view.id(), view);
            }
        }
        return new ArrayList<>(byId.values());
    }
}
