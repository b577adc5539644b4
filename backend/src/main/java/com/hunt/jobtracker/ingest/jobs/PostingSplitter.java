package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.model.SplitPosting;
import com.hunt.jobtracker.ingest.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a one-line posting summary into title, employer and location.
 *
 * <p>LinkedIn alert cards render as {@code "Title<many spaces>Company · Location"}; that
 * layout is tried first. Otherwise {@code " at "}, the last {@code " - "} and the last
 * {@code ", "} are tried in turn, each with a guard against splitting inside a title or a
 * location clause.
 */
@Component
public class PostingSplitter {
    static final char MIDDOT = '·';
    static final int MAX_COMMA_EMPLOYER_LENGTH = 50;

    private static final Pattern COLUMN_GAP = Pattern.compile("\\s{2,}");

    public SplitPosting split(String text) {
        if (text == null || text.isBlank()) {
            return new SplitPosting("", null, null);
        }
        String trimmed = text.trim();
        Optional<SplitPosting> linkedIn = splitLinkedInLayout(trimmed);
        if (linkedIn.isPresent()) {
            return linkedIn.get();
        }

        int at = TextUtils.indexOfIgnoreCase(trimmed, " at ");
        if (at >= 0) {
            String employer = trimmed.substring(at + 4).trim();
            if (!employer.isEmpty()) {
                return posting(trimmed.substring(0, at), employer, null);
            }
        }

        int dash = trimmed.lastIndexOf(" - ");
        if (dash >= 0) {
            String employer = trimmed.substring(dash + 3).trim();
            String lower = employer.toLowerCase(Locale.ROOT);
            if (!employer.isEmpty() && !lower.contains("engineer") && !lower.contains("developer")) {
                return posting(trimmed.substring(0, dash), employer, null);
            }
        }

        int comma = trimmed.lastIndexOf(", ");
        if (comma >= 0) {
            String employer = trimmed.substring(comma + 2).trim();
            if (!employer.isEmpty()
                && employer.length() < MAX_COMMA_EMPLOYER_LENGTH
                && !employer.contains("Remote")
                && !employer.contains("Hybrid")) {
                return posting(trimmed.substring(0, comma), employer, null);
            }
        }

        return posting(trimmed, null, null);
    }

    /**
     * Everything after the middot is the location; before it, the last run of two or more
     * spaces separates title from company. Empty when either half is missing.
     */
    public Optional<SplitPosting> splitLinkedInLayout(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        int middot = trimmed.indexOf(MIDDOT);
        if (middot < 0) {
            return Optional.empty();
        }
        String beforeMiddot = trimmed.substring(0, middot).trim();
        String location = trimmed.substring(middot + 1);

        Matcher gap = COLUMN_GAP.matcher(beforeMiddot);
        int gapStart = -1;
        int gapEnd = -1;
        while (gap.find()) {
            gapStart = gap.start();
            gapEnd = gap.end();
        }
        if (gapStart < 0) {
            return Optional.empty();
        }
        String title = beforeMiddot.substring(0, gapStart).trim();
        String company = beforeMiddot.substring(gapEnd).trim();
        if (title.isEmpty() || company.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(posting(title, company, location));
    }

    private static SplitPosting posting(String title, String employer, String location) {
        return new SplitPosting(
            TextUtils.collapseWhitespace(title),
            TextUtils.blankToNull(TextUtils.collapseWhitespace(employer)),
            TextUtils.blankToNull(TextUtils.collapseWhitespace(location))
        );
    }
}
