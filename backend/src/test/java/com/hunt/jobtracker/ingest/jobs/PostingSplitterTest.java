package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.model.SplitPosting;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PostingSplitterTest {
    private final PostingSplitter splitter = new PostingSplitter();

    @Test
    void linkedInCardLayout() {
        SplitPosting split = splitter.split(
            "Staff DevOps Engineer, DevInfra             SandboxAQ · United States (Remote)"
        );

        assertEquals(new SplitPosting("Staff DevOps Engineer, DevInfra", "SandboxAQ", "United States (Remote)"), split);
    }

    @Test
    void atSeparatorIsCaseInsensitive() {
        assertEquals(new SplitPosting("Backend Engineer", "Stripe", null), splitter.split("Backend Engineer at Stripe"));
        assertEquals(new SplitPosting("SRE", "Initech", null), splitter.split("SRE AT Initech"));
    }

    @Test
    void dashSeparatorUnlessRightSideIsATitle() {
        assertEquals(
            new SplitPosting("Platform Engineer", "Acme Corp", null),
            splitter.split("Platform Engineer - Acme Corp")
        );
        assertEquals(
            new SplitPosting("Acme Corp - Senior Software Engineer", null, null),
            splitter.split("Acme Corp - Senior Software Engineer")
        );
    }

    @Test
    void commaSeparatorUnlessRightSideIsAWorkMode() {
        assertEquals(new SplitPosting("Data Engineer", "Globex", null), splitter.split("Data Engineer, Globex"));
        assertEquals(
            new SplitPosting("Site Reliability Engineer, Remote", null, null),
            splitter.split("Site Reliability Engineer, Remote")
        );
    }

    @Test
    void commaSeparatorNeedsShortEmployer() {
        String fortyNine = "a".repeat(49);
        String fifty = "a".repeat(50);

        assertEquals(new SplitPosting("Software Engineer", fortyNine, null), splitter.split("Software Engineer, " + fortyNine));
        assertEquals(
            new SplitPosting("Software Engineer, " + fifty, null, null),
            splitter.split("Software Engineer, " + fifty)
        );
    }

    @Test
    void commaSeparatorIgnoresHybrid() {
        assertEquals(new SplitPosting("Data Engineer, Hybrid", null, null), splitter.split("Data Engineer, Hybrid"));
    }

    @Test
    void blankInput() {
        assertEquals(new SplitPosting("", null, null), splitter.split("  "));
    }

    @Test
    void linkedInLayoutNeedsColumnGap() {
        assertThat(splitter.splitLinkedInLayout("Engineer Acme · Remote")).isEmpty();
        assertThat(splitter.splitLinkedInLayout("No middot here")).isEmpty();
    }
}
