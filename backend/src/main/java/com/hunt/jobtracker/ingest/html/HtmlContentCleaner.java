package com.hunt.jobtracker.ingest.html;

import com.hunt.jobtracker.ingest.jobs.ExtractionPhrases;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders an HTML fragment (a description container's inner HTML or an email body) as
 * plain text. Block structure becomes newlines, list items become bullets, and job board
 * chrome is dropped. The result is cut at the first end-of-posting marker.
 */
@Component
public class HtmlContentCleaner {
    public static final String BULLET = "• ";

    /** Direct text longer than this is checked for inlined script signatures. */
    static final int SCRIPT_TEXT_MIN_LENGTH = 50;

    /**
     * Elements whose full text is at least this long are never dropped for containing a
     * UI noise phrase, so a real description that mentions one is kept.
     */
    static final int NOISE_ELEMENT_MAX_LENGTH = 500;

    private static final Set<String> LINE_TAGS = Set.of("p", "div", "h1", "h2", "h3", "h4", "h5", "h6");

    public String clean(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(html);
        StringBuilder out = new StringBuilder();
        renderChildren(document.body(), out);
        return truncateAtEndMarker(normalizeLines(out.toString()));
    }

    private void renderChildren(Element parent, StringBuilder out) {
        for (Node child : parent.childNodes()) {
            render(child, out);
        }
    }

    private void render(Node node, StringBuilder out) {
        if (node instanceof TextNode textNode) {
            String text = textNode.text().trim();
            if (!text.isEmpty()) {
                out.append(text).append(' ');
            }
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }
        String tag = element.normalName();
        if (ExtractionPhrases.SKIPPED_TAGS.contains(tag) || isInlinedScript(element) || isUiNoise(element)) {
            return;
        }
        switch (tag) {
            case "li" -> {
                StringBuilder item = new StringBuilder();
                renderChildren(element, item);
                out.append(BULLET).append(item.toString().trim()).append('\n');
            }
            case "br" -> out.append('\n');
            default -> {
                renderChildren(element, out);
                if (LINE_TAGS.contains(tag)) {
                    out.append('\n');
                }
            }
        }
    }

    private boolean isInlinedScript(Element element) {
        String ownText = element.ownText();
        if (ownText.length() <= SCRIPT_TEXT_MIN_LENGTH) {
            return false;
        }
        for (String signature : ExtractionPhrases.SCRIPT_SIGNATURES) {
            if (ownText.contains(signature)) {
                return true;
            }
        }
        return false;
    }

    private boolean isUiNoise(Element element) {
        String fullText = element.text();
        if (fullText.length() >= NOISE_ELEMENT_MAX_LENGTH) {
            return false;
        }
        String lower = fullText.toLowerCase(Locale.ROOT);
        for (String phrase : ExtractionPhrases.UI_NOISE_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    static String normalizeLines(String text) {
        return Arrays.stream(text.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));
    }

    static String truncateAtEndMarker(String text) {
        for (String marker : ExtractionPhrases.END_OF_CONTENT_MARKERS) {
            int idx = text.indexOf(marker);
            if (idx >= 0) {
                return text.substring(0, idx).trim();
            }
        }
        return text;
    }
}
