package com.hunt.jobtracker.ingest.jobs;

import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ClosedPostingDetector {

    /** True when the text says the posting stopped taking applications. */
    public boolean detectClosed(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : ExtractionPhrases.CLOSURE_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
