package com.hunt.jobtracker.ingest.model;

import java.util.Locale;

public enum JobSource {
    LINKEDIN("linkedin"),
    INDEED("indeed"),
    EMAIL_GENERIC("email"),
    SCRAPE("scrape"),
    MANUAL("manual");

    private final String code;

    JobSource(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static JobSource fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (JobSource source : values()) {
            if (source.code.equals(normalized)) {
                return source;
            }
        }
        return null;
    }
}
