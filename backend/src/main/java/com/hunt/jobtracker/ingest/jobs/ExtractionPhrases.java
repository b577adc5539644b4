package com.hunt.jobtracker.ingest.jobs;

import java.util.List;

/**
 * Phrase tables behind the extraction heuristics. All entries are lower-case unless a
 * list says it is matched case-sensitively.
 */
public final class ExtractionPhrases {

    /** Tags whose subtree never carries posting text. */
    public static final List<String> SKIPPED_TAGS = List.of("script", "style", "noscript", "svg", "path", "title");

    /** Markers of inlined page state or bundler output leaking into the DOM as text. */
    public static final List<String> SCRIPT_SIGNATURES = List.of(
        "window.__",
        "webpack",
        "module_cache",
        "__como_"
    );

    /** Job board UI chrome. Only short elements containing one of these are dropped. */
    public static final List<String> UI_NOISE_PHRASES = List.of(
        "set alert for similar jobs",
        "tailor my resume",
        "show premium insights",
        "try premium",
        "am i a good fit for this job",
        "how can i best position myself",
        "show match details",
        "help me stand out",
        "people you can reach out to",
        "see how you compare",
        "get job alerts",
        "save this job"
    );

    /** Case-sensitive; the cleaned text is cut at the first marker of this list that occurs. */
    public static final List<String> END_OF_CONTENT_MARKERS = List.of(
        "… more",
        "More jobs",
        "Looking for talent?",
        "Actively reviewing applicants",
        "LinkedIn Corporation ©",
        "Select language"
    );

    public static final List<String> CLOSURE_PHRASES = List.of(
        "no longer accepting applications",
        "no longer accepting applicants",
        "this position has been filled",
        "this job has been filled",
        "application window has closed",
        "applications are closed",
        "this job is no longer available",
        "this position is no longer available",
        "this job posting has expired",
        "job has expired",
        "position has been closed"
    );

    /** Labels that introduce an employer-assigned requisition code, tried in order. */
    public static final List<String> JOB_CODE_LABELS = List.of(
        "job id:",
        "job code:",
        "requisition id:",
        "req id:",
        "req#:",
        "req #:",
        "job #:",
        "job number:",
        "job no:",
        "reference:",
        "ref:"
    );

    /** Link texts that are exactly UI navigation. */
    public static final List<String> NAVIGATION_EXACT = List.of(
        "jobs",
        "search for jobs",
        "see all jobs",
        "view all",
        "search other jobs"
    );

    public static final List<String> NAVIGATION_PREFIXES = List.of(
        "jobs similar to",
        "jobs in ",
        "manage job"
    );

    public static final List<String> NAVIGATION_FRAGMENTS = List.of(
        "unsubscribe",
        "privacy"
    );

    /** Case-sensitive URL fragments of search and alert pages. */
    public static final List<String> SEARCH_LINK_FRAGMENTS = List.of(
        "/jobs/search",
        "/search?",
        "/jobs/alerts"
    );

    /** Call-to-action texts that sometimes got stored as titles. */
    public static final List<String> STORED_ARTIFACT_PATTERNS = List.of(
        "view this job",
        "view job",
        "apply now",
        "see more",
        "view all",
        "click here",
        "learn more",
        "read more",
        "get started",
        "sign in",
        "log in",
        "unsubscribe"
    );

    private ExtractionPhrases() {
    }
}
