package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls an employer-assigned requisition code out of posting text or a posting URL.
 * Labelled fields win over the LinkedIn view id, which wins over a bare {@code JR} code.
 */
@Component
public class JobCodeExtractor {
    static final int MAX_LABELLED_CODE_LENGTH = 50;
    static final int MIN_JR_CODE_LENGTH = 4;
    static final int MAX_JR_CODE_LENGTH = 20;

    private static final Pattern LINKEDIN_VIEW_ID = Pattern.compile("/jobs?/view/(\\d+)");
    private static final Pattern JR_CODE = Pattern.compile("JR([A-Za-z0-9-]+)");

    public Optional<String> extractJobCode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (String label : ExtractionPhrases.JOB_CODE_LABELS) {
            Optional<String> code = labelledCode(text, label);
            if (code.isPresent()) {
                return code;
            }
        }

        Matcher viewMatcher = LINKEDIN_VIEW_ID.matcher(text);
        if (viewMatcher.find()) {
            return Optional.of("linkedin-" + viewMatcher.group(1));
        }

        Matcher jrMatcher = JR_CODE.matcher(text);
        while (jrMatcher.find()) {
            String code = jrMatcher.group(1);
            if (code.length() >= MIN_JR_CODE_LENGTH && code.length() <= MAX_JR_CODE_LENGTH) {
                return Optional.of("JR" + code);
            }
        }
        return Optional.empty();
    }

    private Optional<String> labelledCode(String text, String label) {
        int idx = TextUtils.indexOfIgnoreCase(text, label);
        if (idx < 0) {
            return Optional.empty();
        }
        int pos = idx + label.length();
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        int start = pos;
        while (pos < text.length() && isCodeChar(text.charAt(pos))) {
            pos++;
        }
        int length = pos - start;
        if (length == 0 || length > MAX_LABELLED_CODE_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, pos));
    }

    private static boolean isCodeChar(char c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '_'
            || c == '/'
            || c == '-';
    }
}
