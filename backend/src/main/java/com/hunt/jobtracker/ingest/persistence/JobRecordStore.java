package com.hunt.jobtracker.ingest.persistence;

import com.hunt.jobtracker.ingest.model.EmployerStatus;
import com.hunt.jobtracker.ingest.model.ExistingRecordView;
import com.hunt.jobtracker.ingest.model.JobDescription;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.model.RankingCandidate;
import com.hunt.jobtracker.ingest.model.StoredJob;

import java.util.List;
import java.util.Optional;

public interface JobRecordStore extends RecordLookup {
    long insert(ParsedJob job);

    /** All records, oldest first; ties on creation time break by id. */
    List<ExistingRecordView> findAllInInsertionOrder();

    /**
     * Records with a URL whose description has not been fetched yet, or every record with a
     * URL when {@code force} is set. A non-positive limit means no limit.
     */
    List<StoredJob> findMissingDescriptions(int limit, boolean force);

    Optional<StoredJob> findById(long id);

    void updateDescription(long id, JobDescription description);

    boolean delete(long id);

    boolean updateStatus(long id, JobStatus status);

    /** Creates the employer when it is not on file yet. Returns the employer id. */
    long setEmployerStatus(String employer, EmployerStatus status);

    /** Employer names with the given status, alphabetically; every employer when status is null. */
    List<String> findEmployerNames(EmployerStatus status);

    /** Jobs whose status is still open, oldest first, each with its employer's status. */
    List<RankingCandidate> findRankingCandidates();
}
