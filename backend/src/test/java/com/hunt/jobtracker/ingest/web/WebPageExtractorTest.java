package com.hunt.jobtracker.ingest.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hunt.jobtracker.ingest.html.HtmlContentCleaner;
import com.hunt.jobtracker.ingest.jobs.ClosedPostingDetector;
import com.hunt.jobtracker.ingest.jobs.JobCodeExtractor;
import com.hunt.jobtracker.ingest.jobs.PayRangeExtractor;
import com.hunt.jobtracker.ingest.model.JobDescription;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebPageExtractorTest {
    private final WebPageExtractor extractor = new WebPageExtractor(
        new HtmlContentCleaner(),
        new PayRangeExtractor(),
        new JobCodeExtractor(),
        new ClosedPostingDetector(),
        new StructuredPostingReader(new ObjectMapper())
    );

    @Test
    void readsFirstDescriptionContainer() {
        String html = """
            <html><body>
              <nav><a href="/jobs">Jobs</a></nav>
              <div class="show-more-less-html__markup">
                <p>About the role</p>
                <ul><li>Own CI pipelines</li></ul>
                <p>Salary: $150K - $190K</p>
                <p>Job ID: ABC-123</p>
              </div>
            </body></html>
            """;

        JobDescription description = extractor.extract(html);

        assertEquals("About the role\n• Own CI pipelines\nSalary: $150K - $190K\nJob ID: ABC-123", description.text());
        assertEquals(150_000L, description.payMin());
        assertEquals(190_000L, description.payMax());
        assertEquals("ABC-123", description.jobCode());
        assertFalse(description.noLongerAccepting());
    }

    @Test
    void fallsBackToBody() {
        JobDescription description = extractor.extract("<html><body><p>Only body text here.</p></body></html>");

        assertEquals("Only body text here.", description.text());
    }

    @Test
    void jobCodeFromStructuredDataWhenTextHasNone() {
        String html = """
            <html>
            <head>
              <script type="application/ld+json">
                {"@context":"https://schema.org","@type":"JobPosting","title":"SRE",
                 "identifier":{"@type":"PropertyValue","value":"REQ-77"}}
              </script>
            </head>
            <body><div id="job-details"><p>Keep production healthy.</p></div></body>
            </html>
            """;

        JobDescription description = extractor.extract(html);

        assertEquals("Keep production healthy.", description.text());
        assertEquals("REQ-77", description.jobCode());
    }

    @Test
    void malformedStructuredDataIsIgnored() {
        String html = """
            <html><head><script type="application/ld+json">{"@type": "JobPosting", </script></head>
            <body><p>Plain posting.</p></body></html>
            """;

        assertNull(extractor.extract(html).jobCode());
    }

    @Test
    void closedPostingIsFlagged() {
        String html = "<div id=\"job-details\"><p>No longer accepting applications</p></div>";

        assertTrue(extractor.extract(html).noLongerAccepting());
    }

    @Test
    void detectsSignInWall() {
        assertTrue(extractor.requiresSignIn("<form><input name=\"session_key\"></form>", "https://www.linkedin.com/jobs/view/1"));
        assertTrue(extractor.requiresSignIn("<html></html>", "https://www.linkedin.com/authwall?trk=x"));
        assertTrue(extractor.requiresSignIn("<button aria-label=\"Sign in to apply\">Go</button>", null));
        assertFalse(extractor.requiresSignIn("<p>Job description</p>", "https://example.com/jobs/1"));
    }

    @Test
    void emptyPageHasNoDescription() {
        assertThat(extractor.extract("").isEmpty()).isTrue();
    }
}
