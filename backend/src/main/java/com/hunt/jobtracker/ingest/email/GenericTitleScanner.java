package com.hunt.jobtracker.ingest.email;

import com.hunt.jobtracker.ingest.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds engineering job titles in free text when an email has no recognizable job cards.
 */
@Component
public class GenericTitleScanner {
    static final int MIN_TITLE_LENGTH = 6;

    private static final Pattern ENGINEERING_TITLE = Pattern.compile(
        "(?i)(senior|staff|principal|lead|junior|sr\\.?|jr\\.?)?\\s*"
            + "(software|devops|platform|infrastructure|site reliability|sre|cloud|backend|frontend|"
            + "full[- ]?stack|data|ml|machine learning)\\s*"
            + "(engineer|developer|architect|manager|lead|specialist)"
    );

    public List<String> scan(String text) {
        List<String> titles = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return titles;
        }
        Matcher matcher = ENGINEERING_TITLE.matcher(text);
        while (matcher.find()) {
            String title = TextUtils.collapseWhitespace(matcher.group());
            if (title.length() >= MIN_TITLE_LENGTH) {
                titles.add(title);
            }
        }
        return titles;
    }
}
