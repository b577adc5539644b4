package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.model.SplitPosting;
import com.hunt.jobtracker.ingest.util.TextUtils;
import org.springframework.stereotype.Component;

/**
 * Parses a posting pasted by hand. The first line is the summary; pay, job code and closure
 * are read from the whole paste.
 */
@Component
public class FreeformPostingParser {
    static final int MAX_TITLE_LENGTH = 100;
    static final int MAX_EMPLOYER_LENGTH = 50;

    private final PostingSplitter splitter;
    private final ParsedJobFactory jobFactory;

    public FreeformPostingParser(PostingSplitter splitter, ParsedJobFactory jobFactory) {
        this.splitter = splitter;
        this.jobFactory = jobFactory;
    }

    public ParsedJob parse(String content) {
        String text = content == null ? "" : content.strip();
        String firstLine = text.lines().findFirst().orElse("");
        SplitPosting split = splitter.split(firstLine);
        String employer = split.employer() != null ? split.employer() : employerAfterAt(text);
        SplitPosting summary = new SplitPosting(
            TextUtils.truncate(split.title(), MAX_TITLE_LENGTH),
            employer,
            split.location()
        );
        return jobFactory.create(summary, null, text, JobSource.MANUAL);
    }

    /**
     * "... at Acme, Inc." anywhere in the paste: the text after {@code " at "} up to the next
     * newline, comma or hyphen.
     */
    String employerAfterAt(String text) {
        int idx = TextUtils.indexOfIgnoreCase(text, " at ");
        if (idx < 0) {
            return null;
        }
        String after = text.substring(idx + 4);
        int end = after.length();
        for (int i = 0; i < after.length(); i++) {
            char c = after.charAt(i);
            if (c == '\n' || c == ',' || c == '-') {
                end = i;
                break;
            }
        }
        String company = after.substring(0, end).trim();
        if (company.isEmpty() || company.length() >= MAX_EMPLOYER_LENGTH) {
            return null;
        }
        return company;
    }
}
