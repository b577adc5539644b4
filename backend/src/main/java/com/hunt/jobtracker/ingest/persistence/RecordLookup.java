package com.hunt.jobtracker.ingest.persistence;

import com.hunt.jobtracker.ingest.model.ExistingRecordView;

import java.util.List;

/**
 * The slice of stored records a duplicate check needs: everything at one employer plus
 * anything already filed under the same URL.
 */
public interface RecordLookup {
    List<ExistingRecordView> findByEmployer(String employer);

    List<ExistingRecordView> findByUrl(String url);
}
