package com.hunt.jobtracker.ingest.jobs;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Rejects alert-email and page fragments that are UI navigation rather than postings:
 * "See all jobs", "Jobs in Seattle", "Engineering Manager jobs" search links, footer links.
 */
@Component
public class NavigationArtifactFilter {
    static final int MIN_POSTING_TEXT_LENGTH = 10;
    static final int MIN_STORED_TITLE_LENGTH = 5;
    static final int MAX_STORED_ARTIFACT_LENGTH = 50;

    public boolean isNavigationArtifact(String text) {
        if (text == null) {
            return true;
        }
        String trimmed = text.trim();
        if (trimmed.length() < MIN_POSTING_TEXT_LENGTH) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (ExtractionPhrases.NAVIGATION_EXACT.contains(lower)) {
            return true;
        }
        for (String prefix : ExtractionPhrases.NAVIGATION_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        for (String fragment : ExtractionPhrases.NAVIGATION_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        // "Engineering Manager jobs" links to a search page; "Jobs Program Manager" is a title.
        return trimmed.endsWith(" jobs") || trimmed.endsWith(" Jobs");
    }

    public boolean isSearchLink(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        for (String fragment : ExtractionPhrases.SEARCH_LINK_FRAGMENTS) {
            if (url.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Looser check for titles that already made it into storage: very short titles, or short
     * titles that read like a call to action.
     */
    public boolean isStoredArtifactTitle(String title) {
        if (title == null || title.length() < MIN_STORED_TITLE_LENGTH) {
            return true;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        if (lower.length() >= MAX_STORED_ARTIFACT_LENGTH) {
            return false;
        }
        for (String pattern : ExtractionPhrases.STORED_ARTIFACT_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
