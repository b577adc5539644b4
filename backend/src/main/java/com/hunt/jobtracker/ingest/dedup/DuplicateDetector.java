package com.hunt.jobtracker.ingest.dedup;

import com.hunt.jobtracker.ingest.model.DuplicatePair;
import com.hunt.jobtracker.ingest.model.ExistingRecordView;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Decides whether a posting is already known.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>identical URL, regardless of title or employer;</li>
 *   <li>same employer (case-insensitive) and identical normalized title;</li>
 *   <li>same employer and one normalized title contains the other;</li>
 *   <li>same employer and Jaro-Winkler similarity above {@link #FUZZY_TITLE_THRESHOLD}.</li>
 * </ol>
 * Without an employer on both sides only the URL rule can fire.
 */
@Component
public class DuplicateDetector {
    /** Titles strictly more similar than this at the same employer are the same posting. */
    public static final double FUZZY_TITLE_THRESHOLD = 0.8;

    private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

    public OptionalLong findDuplicate(ParsedJob candidate, List<ExistingRecordView> corpus) {
        return findDuplicate(candidate.title(), candidate.employer(), candidate.url(), corpus);
    }

    public OptionalLong findDuplicate(String title, String employer, String url, List<ExistingRecordView> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            return OptionalLong.empty();
        }
        if (url != null) {
            for (ExistingRecordView existing : corpus) {
                if (url.equals(existing.url())) {
                    return OptionalLong.of(existing.id());
                }
            }
        }
        if (employer == null) {
            return OptionalLong.empty();
        }
        String normalizedTitle = normalizeTitle(title);
        for (ExistingRecordView existing : corpus) {
            if (sameEmployer(employer, existing.employer())
                && titlesMatch(normalizedTitle, normalizeTitle(existing.title()))) {
                return OptionalLong.of(existing.id());
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Scans a corpus for postings that duplicate an earlier one. Each record is compared with
     * the records before it, skipping those already flagged, and the first match is reported.
     * Matches are not merged transitively: a record yields at most one pair.
     *
     * @param corpus records in ascending insertion order
     */
    public List<DuplicatePair> findDuplicates(List<ExistingRecordView> corpus) {
        List<DuplicatePair> duplicates = new ArrayList<>();
        if (corpus == null || corpus.size() < 2) {
            return duplicates;
        }
        Set<Long> flagged = new HashSet<>();
        for (int i = 1; i < corpus.size(); i++) {
            ExistingRecordView record = corpus.get(i);
            for (int j = 0; j < i; j++) {
                ExistingRecordView earlier = corpus.get(j);
                if (flagged.contains(earlier.id())) {
                    continue;
                }
                if (isDuplicate(record, earlier)) {
                    duplicates.add(new DuplicatePair(
                        earlier.id(),
                        record.id(),
                        String.format(
                            "Job #%d ('%s') duplicates job #%d ('%s')",
                            record.id(), record.title(), earlier.id(), earlier.title()
                        )
                    ));
                    flagged.add(record.id());
                    break;
                }
            }
        }
        return duplicates;
    }

    boolean isDuplicate(ExistingRecordView record, ExistingRecordView earlier) {
        if (record.url() != null && record.url().equals(earlier.url())) {
            return true;
        }
        return record.employer() != null
            && sameEmployer(record.employer(), earlier.employer())
            && titlesMatch(normalizeTitle(record.title()), normalizeTitle(earlier.title()));
    }

    boolean titlesMatch(String normalized, String otherNormalized) {
        // An empty title would be a substring of everything.
        if (normalized.isEmpty() || otherNormalized.isEmpty()) {
            return false;
        }
        if (normalized.equals(otherNormalized)) {
            return true;
        }
        if (normalized.contains(otherNormalized) || otherNormalized.contains(normalized)) {
            return true;
        }
        return similarity.apply(normalized, otherNormalized) > FUZZY_TITLE_THRESHOLD;
    }

    public static String normalizeTitle(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean sameEmployer(String employer, String otherEmployer) {
        return employer != null && otherEmployer != null && employer.trim().equalsIgnoreCase(otherEmployer.trim());
    }
}
