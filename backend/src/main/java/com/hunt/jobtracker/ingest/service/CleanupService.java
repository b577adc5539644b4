package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.ingest.dedup.DuplicateDetector;
import com.hunt.jobtracker.ingest.jobs.NavigationArtifactFilter;
import com.hunt.jobtracker.ingest.model.CleanupSummary;
import com.hunt.jobtracker.ingest.model.DuplicatePair;
import com.hunt.jobtracker.ingest.model.ExistingRecordView;
import com.hunt.jobtracker.ingest.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Removes stored records that should never have been admitted: link-text artifacts saved as
 * titles, and later copies of a posting already on file.
 */
@Service
public class CleanupService {
    private static final Logger log = LoggerFactory.getLogger(CleanupService.class);

    private final JobRecordStore store;
    private final NavigationArtifactFilter navigationFilter;
    private final DuplicateDetector duplicateDetector;

    public CleanupService(
        JobRecordStore store,
        NavigationArtifactFilter navigationFilter,
        DuplicateDetector duplicateDetector
    ) {
        this.store = store;
        this.navigationFilter = navigationFilter;
        this.duplicateDetector = duplicateDetector;
    }

    public int cleanupArtifacts(boolean dryRun) {
        int removed = 0;
        for (ExistingRecordView record : store.findAllInInsertionOrder()) {
            if (!navigationFilter.isStoredArtifactTitle(record.title())) {
                continue;
            }
            log.info("{}Artifact job #{} ('{}')", dryRun ? "[dry-run] " : "", record.id(), record.title());
            if (!dryRun) {
                store.delete(record.id());
            }
            removed++;
        }
        return removed;
    }

    public int cleanupDuplicates(boolean dryRun) {
        List<DuplicatePair> pairs = duplicateDetector.findDuplicates(store.findAllInInsertionOrder());
        for (DuplicatePair pair : pairs) {
            log.info("{}{}", dryRun ? "[dry-run] " : "", pair.reason());
            if (!dryRun) {
                store.delete(pair.duplicateId());
            }
        }
        return pairs.size();
    }

    public CleanupSummary cleanupAll(boolean dryRun) {
        int artifacts = cleanupArtifacts(dryRun);
        int duplicates = cleanupDuplicates(dryRun);
        log.info("Cleanup{}: artifacts={}, duplicates={}", dryRun ? " [dry-run]" : "", artifacts, duplicates);
        return new CleanupSummary(artifacts, duplicates, dryRun);
    }
}
