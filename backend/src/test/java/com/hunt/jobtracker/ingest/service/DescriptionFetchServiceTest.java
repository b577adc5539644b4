package com.hunt.jobtracker.ingest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hunt.jobtracker.config.HuntProperties;
import com.hunt.jobtracker.ingest.html.HtmlContentCleaner;
import com.hunt.jobtracker.ingest.http.JobPageFetcher;
import com.hunt.jobtracker.ingest.jobs.ClosedPostingDetector;
import com.hunt.jobtracker.ingest.jobs.JobCodeExtractor;
import com.hunt.jobtracker.ingest.jobs.PayRangeExtractor;
import com.hunt.jobtracker.ingest.model.DescriptionFetchSummary;
import com.hunt.jobtracker.ingest.model.JobDescription;
import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.StoredJob;
import com.hunt.jobtracker.ingest.persistence.JobRecordStore;
import com.hunt.jobtracker.ingest.web.StructuredPostingReader;
import com.hunt.jobtracker.ingest.web.WebPageExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DescriptionFetchServiceTest {
    private static final String POSTING_HTML =
        "<html><body><div id=\"job-details\"><p>Build pipelines.</p><p>$140K - $160K</p></div></body></html>";

    @Mock
    private JobRecordStore store;
    @Mock
    private JobPageFetcher fetcher;
    @Mock
    private FetchPacer pacer;

    private DescriptionFetchService service;

    @BeforeEach
    void setUp() {
        WebPageExtractor extractor = new WebPageExtractor(
            new HtmlContentCleaner(),
            new PayRangeExtractor(),
            new JobCodeExtractor(),
            new ClosedPostingDetector(),
            new StructuredPostingReader(new ObjectMapper())
        );
        service = new DescriptionFetchService(store, fetcher, extractor, pacer, new HuntProperties());
    }

    @Test
    void recordsPerJobFailuresAndContinues() throws IOException {
        StoredJob ok = job(1, "https://example.com/jobs/1");
        StoredJob unreachable = job(2, "https://example.com/jobs/2");
        StoredJob walled = job(3, "https://www.linkedin.com/jobs/view/3");
        when(store.findMissingDescriptions(10, false)).thenReturn(List.of(ok, unreachable, walled));
        when(pacer.pause()).thenReturn(true);
        when(fetcher.fetch("https://example.com/jobs/1"))
            .thenReturn(new JobPageFetcher.FetchedPage(POSTING_HTML, "https://example.com/jobs/1"));
        when(fetcher.fetch("https://example.com/jobs/2")).thenThrow(new IOException("connect timed out"));
        when(fetcher.fetch("https://www.linkedin.com/jobs/view/3"))
            .thenReturn(new JobPageFetcher.FetchedPage("<html></html>", "https://www.linkedin.com/authwall?trk=x"));

        DescriptionFetchSummary summary = service.fetchMissing(10, false);

        assertThat(summary.attempted()).isEqualTo(3);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.failures()).containsOnlyKeys(2L, 3L);
        assertThat(summary.failures().get(3L)).isEqualTo("sign-in required");

        ArgumentCaptor<JobDescription> stored = ArgumentCaptor.forClass(JobDescription.class);
        verify(store).updateDescription(eq(1L), stored.capture());
        assertThat(stored.getValue().text()).isEqualTo("Build pipelines.\n$140K - $160K");
        assertThat(stored.getValue().payMin()).isEqualTo(140_000L);
    }

    @Test
    void nonHttpUrlIsNotFetched() throws IOException {
        when(store.findById(4L)).thenReturn(Optional.of(job(4, "file:///etc/passwd")));

        DescriptionFetchSummary summary = service.fetchOne(4L);

        assertThat(summary.failed()).isEqualTo(1);
        verify(fetcher, never()).fetch(any());
    }

    @Test
    void unknownJobIsAnError() {
        when(store.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.fetchOne(99L)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void interruptedPauseStopsTheBatch() throws IOException {
        when(store.findMissingDescriptions(0, true))
            .thenReturn(List.of(job(1, "https://example.com/jobs/1"), job(2, "https://example.com/jobs/2")));
        when(fetcher.fetch("https://example.com/jobs/1"))
            .thenReturn(new JobPageFetcher.FetchedPage(POSTING_HTML, "https://example.com/jobs/1"));
        when(pacer.pause()).thenReturn(false);

        DescriptionFetchSummary summary = service.fetchMissing(0, true);

        assertThat(summary.attempted()).isEqualTo(1);
        verify(fetcher, never()).fetch("https://example.com/jobs/2");
        verify(store).updateDescription(anyLong(), any());
    }

    private static StoredJob job(long id, String url) {
        Instant now = Instant.now();
        return new StoredJob(id, "Backend Engineer", "Globex", url, JobSource.LINKEDIN, JobStatus.NEW,
            null, null, null, false, "", now, now);
    }
}
