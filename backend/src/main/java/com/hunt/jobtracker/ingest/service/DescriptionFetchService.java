package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import com.hunt.jobtracker.ingest.http.JobPageFetcher;
import com.hunt.jobtracker.ingest.model.DescriptionFetchSummary;
import com.hunt.jobtracker.ingest.model.JobDescription;
import com.hunt.jobtracker.ingest.model.StoredJob;
import com.hunt.jobtracker.ingest.persistence.JobRecordStore;
import com.hunt.jobtracker.ingest.util.JobUrlUtils;
import com.hunt.jobtracker.ingest.web.WebPageExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DescriptionFetchService {
    private static final Logger log = LoggerFactory.getLogger(DescriptionFetchService.class);

    private final JobRecordStore store;
    private final JobPageFetcher fetcher;
    private final WebPageExtractor extractor;
    private final FetchPacer pacer;
    private final HuntProperties properties;

    public DescriptionFetchService(
        JobRecordStore store,
        JobPageFetcher fetcher,
        WebPageExtractor extractor,
        FetchPacer pacer,
        HuntProperties properties
    ) {
        this.store = store;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.pacer = pacer;
        this.properties = properties;
    }

    public DescriptionFetchSummary fetchMissing() {
        return fetchMissing(properties.getFetch().getLimit(), properties.getFetch().isForce());
    }

    public DescriptionFetchSummary fetchMissing(int limit, boolean force) {
        List<StoredJob> jobs = store.findMissingDescriptions(limit, force);
        log.info("Fetching descriptions for {} job(s){}", jobs.size(), force ? " (forced)" : "");
        DescriptionFetchSummary summary = fetchAll(jobs);
        log.info(
            "Description fetch finished: attempted={}, succeeded={}, failed={}",
            summary.attempted(),
            summary.succeeded(),
            summary.failed()
        );
        return summary;
    }

    public DescriptionFetchSummary fetchOne(long jobId) {
        StoredJob job = store.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return fetchAll(List.of(job));
    }

    private DescriptionFetchSummary fetchAll(List<StoredJob> jobs) {
        Map<Long, String> failures = new LinkedHashMap<>();
        int attempted = 0;
        int succeeded = 0;
        for (StoredJob job : jobs) {
            if (attempted > 0 && !pacer.pause()) {
                log.warn("Description fetch interrupted after {} job(s)", attempted);
                break;
            }
            attempted++;
            String failure = fetchAndStore(job);
            if (failure == null) {
                succeeded++;
            } else {
                log.warn("Job {} description not fetched: {}", job.id(), failure);
                failures.put(job.id(), failure);
            }
        }
        return new DescriptionFetchSummary(attempted, succeeded, failures.size(), failures);
    }

    /**
     * Returns null on success, otherwise the reason the job was skipped.
     */
    private String fetchAndStore(StoredJob job) {
        if (job.url() == null || job.url().isBlank()) {
            return "no URL";
        }
        if (!JobUrlUtils.isHttpUrl(job.url())) {
            return "not an http(s) URL: " + job.url();
        }
        JobPageFetcher.FetchedPage page;
        try {
            page = fetcher.fetch(job.url());
        } catch (IOException e) {
            return "fetch failed: " + e.getMessage();
        }
        if (extractor.requiresSignIn(page.html(), page.finalUrl())) {
            return "sign-in required";
        }
        JobDescription description = extractor.extract(page.html());
        if (description.isEmpty()) {
            return "no description content";
        }
        store.updateDescription(job.id(), description);
        log.debug("Stored description for job {} ({} chars)", job.id(), description.text().length());
        return null;
    }
}
