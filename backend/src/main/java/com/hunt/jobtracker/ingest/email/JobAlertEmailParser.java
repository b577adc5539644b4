package com.hunt.jobtracker.ingest.email;

import com.hunt.jobtracker.ingest.jobs.NavigationArtifactFilter;
import com.hunt.jobtracker.ingest.jobs.ParsedJobFactory;
import com.hunt.jobtracker.ingest.jobs.PostingSplitter;
import com.hunt.jobtracker.ingest.model.JobAlertEmail;
import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.model.SplitPosting;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a job-alert email body into candidate postings. LinkedIn and Indeed alerts are read
 * from their job links; anything else is scanned for engineering titles.
 */
@Component
public class JobAlertEmailParser {
    private static final Logger log = LoggerFactory.getLogger(JobAlertEmailParser.class);

    static final String LINKEDIN_JOB_LINKS = "a[href*=linkedin.com/comm/jobs]";
    static final String INDEED_LINKS = "a[href*=indeed.com]";
    static final List<String> INDEED_JOB_HREF_HINTS = List.of("/viewjob", "/rc/clk", "jk=");
    static final int GENERIC_RAW_TEXT_LENGTH = 500;

    private final PostingSplitter splitter;
    private final NavigationArtifactFilter navigationFilter;
    private final ParsedJobFactory jobFactory;
    private final GenericTitleScanner titleScanner;

    public JobAlertEmailParser(
        PostingSplitter splitter,
        NavigationArtifactFilter navigationFilter,
        ParsedJobFactory jobFactory,
        GenericTitleScanner titleScanner
    ) {
        this.splitter = splitter;
        this.navigationFilter = navigationFilter;
        this.jobFactory = jobFactory;
        this.titleScanner = titleScanner;
    }

    public List<ParsedJob> parse(JobAlertEmail email) {
        String from = email.from() == null ? "" : email.from().toLowerCase(Locale.ROOT);
        String body = email.body() == null ? "" : email.body();
        List<ParsedJob> jobs;
        if (from.contains("linkedin.com")) {
            jobs = parseLinkedIn(body);
        } else if (from.contains("indeed.com")) {
            jobs = parseIndeed(body);
        } else {
            jobs = parseGeneric(body, JobSource.EMAIL_GENERIC);
        }
        log.debug("Parsed {} job(s) from '{}'", jobs.size(), email.subject());
        return jobs;
    }

    List<ParsedJob> parseLinkedIn(String body) {
        Document document = Jsoup.parse(body);
        List<ParsedJob> jobs = new ArrayList<>();
        for (Element link : document.select(LINKEDIN_JOB_LINKS)) {
            String href = link.attr("href");
            String text = rawText(link).trim();
            if (!isCandidateLink(text, href)) {
                continue;
            }
            SplitPosting split = splitter.split(text);
            if (!split.title().isBlank()) {
                jobs.add(jobFactory.create(split, href, text, JobSource.LINKEDIN));
            }
        }
        if (jobs.isEmpty()) {
            return parseGeneric(body, JobSource.LINKEDIN);
        }
        return collapseRepeatedTitles(jobs);
    }

    List<ParsedJob> parseIndeed(String body) {
        Document document = Jsoup.parse(body);
        List<ParsedJob> jobs = new ArrayList<>();
        for (Element link : document.select(INDEED_LINKS)) {
            String href = link.attr("href");
            String text = rawText(link).trim();
            if (!isCandidateLink(text, href) || !looksLikeIndeedJob(href)) {
                continue;
            }
            SplitPosting split = splitter.split(text);
            if (!split.title().isBlank()) {
                jobs.add(jobFactory.create(split, href, text, JobSource.INDEED));
            }
        }
        return collapseRepeatedTitles(jobs);
    }

    List<ParsedJob> parseGeneric(String body, JobSource source) {
        String text = rawText(Jsoup.parse(body));
        String excerpt = text.length() > GENERIC_RAW_TEXT_LENGTH ? text.substring(0, GENERIC_RAW_TEXT_LENGTH) : text;
        List<ParsedJob> jobs = new ArrayList<>();
        for (String title : titleScanner.scan(text)) {
            jobs.add(jobFactory.create(new SplitPosting(title, null, null), null, excerpt, text, source));
        }
        return collapseRepeatedTitles(jobs);
    }

    private boolean isCandidateLink(String text, String href) {
        if (text.isEmpty()) {
            return false;
        }
        if (navigationFilter.isNavigationArtifact(text)) {
            log.debug("Skipping navigation link '{}'", text);
            return false;
        }
        return !navigationFilter.isSearchLink(href);
    }

    private static boolean looksLikeIndeedJob(String href) {
        for (String hint : INDEED_JOB_HREF_HINTS) {
            if (href.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Alert cards link the same posting several times in a row (title, logo, "view job").
     */
    static List<ParsedJob> collapseRepeatedTitles(List<ParsedJob> jobs) {
        List<ParsedJob> collapsed = new ArrayList<>();
        String previousTitle = null;
        for (ParsedJob job : jobs) {
            String title = job.title().toLowerCase(Locale.ROOT);
            if (!title.equals(previousTitle)) {
                collapsed.add(job);
            }
            previousTitle = title;
        }
        return collapsed;
    }

    /**
     * Descendant text nodes joined with single spaces, whitespace inside each node kept as-is.
     * LinkedIn separates title and company with a run of spaces that {@link Element#text()}
     * would normalize away.
     */
    static String rawText(Element root) {
        List<String> parts = new ArrayList<>();
        collectText(root, parts);
        return String.join(" ", parts);
    }

    private static void collectText(Node node, List<String> parts) {
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode textNode) {
                parts.add(textNode.getWholeText());
            } else if (child instanceof Element element && !"script".equals(element.normalName())
                && !"style".equals(element.normalName())) {
                collectText(element, parts);
            }
        }
    }
}
