package com.hunt.jobtracker.ingest.web;

import com.hunt.jobtracker.ingest.html.HtmlContentCleaner;
import com.hunt.jobtracker.ingest.jobs.ClosedPostingDetector;
import com.hunt.jobtracker.ingest.jobs.JobCodeExtractor;
import com.hunt.jobtracker.ingest.jobs.PayRangeExtractor;
import com.hunt.jobtracker.ingest.model.JobDescription;
import com.hunt.jobtracker.ingest.model.PayRange;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Extracts the description of a scraped job page: the first known description container
 * with content, else the whole body, cleaned and mined for pay, job code and closure.
 */
@Component
public class WebPageExtractor {
    static final List<String> DESCRIPTION_SELECTORS = List.of(
        ".jobs-description__content",
        ".jobs-box__html-content",
        ".show-more-less-html__markup",
        ".description__text",
        "div.jobs-description-content__text",
        "#job-details",
        "article.jobs-description"
    );

    static final List<String> SIGN_IN_SELECTORS = List.of(
        "input[name=session_key]",
        "input[name=session_password]",
        ".authwall",
        "button[aria-label*=Sign in]"
    );

    private final HtmlContentCleaner cleaner;
    private final PayRangeExtractor payRangeExtractor;
    private final JobCodeExtractor jobCodeExtractor;
    private final ClosedPostingDetector closedPostingDetector;
    private final StructuredPostingReader structuredPostingReader;

    public WebPageExtractor(
        HtmlContentCleaner cleaner,
        PayRangeExtractor payRangeExtractor,
        JobCodeExtractor jobCodeExtractor,
        ClosedPostingDetector closedPostingDetector,
        StructuredPostingReader structuredPostingReader
    ) {
        this.cleaner = cleaner;
        this.payRangeExtractor = payRangeExtractor;
        this.jobCodeExtractor = jobCodeExtractor;
        this.closedPostingDetector = closedPostingDetector;
        this.structuredPostingReader = structuredPostingReader;
    }

    public JobDescription extract(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        String text = descriptionText(document);
        PayRange pay = payRangeExtractor.extractPayRange(text);
        String jobCode = jobCodeExtractor.extractJobCode(text)
            .or(() -> structuredPostingReader.identifier(document))
            .orElse(null);
        return new JobDescription(text, pay.min(), pay.max(), jobCode, closedPostingDetector.detectClosed(text));
    }

    /**
     * True when the page is a login wall instead of the posting, judged by the login form
     * markup or by the URL the fetch ended on.
     */
    public boolean requiresSignIn(String html, String finalUrl) {
        if (finalUrl != null && (finalUrl.contains("/login") || finalUrl.contains("/authwall"))) {
            return true;
        }
        if (html == null || html.isBlank()) {
            return false;
        }
        Document document = Jsoup.parse(html);
        for (String selector : SIGN_IN_SELECTORS) {
            if (document.selectFirst(selector) != null) {
                return true;
            }
        }
        return false;
    }

    private String descriptionText(Document document) {
        for (String selector : DESCRIPTION_SELECTORS) {
            Element container = document.selectFirst(selector);
            if (container == null) {
                continue;
            }
            String text = cleaner.clean(container.html());
            if (!text.isEmpty()) {
                return text;
            }
        }
        return cleaner.clean(document.body().html());
    }
}
