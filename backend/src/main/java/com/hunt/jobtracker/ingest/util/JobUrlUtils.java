package com.hunt.jobtracker.ingest.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

public final class JobUrlUtils {
    private JobUrlUtils() {
    }

    /**
     * Strips tracking decoration from a job link. LinkedIn and Indeed alert links carry
     * their tracking ids in the query string, so everything from the first {@code ?}
     * (and any fragment after it) is dropped.
     *
     * @return the cleaned URL, or empty for a blank input
     */
    public static Optional<String> cleanTrackingUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        int cut = trimmed.indexOf('?');
        if (cut < 0) {
            cut = trimmed.indexOf('#');
        }
        String clean = cut >= 0 ? trimmed.substring(0, cut) : trimmed;
        if (clean.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(clean);
    }

    public static boolean isHttpUrl(String candidate) {
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
