package com.hunt.jobtracker.ingest.model;

import java.util.Locale;

/** How the user feels about an employer; drives the ranking penalty. */
public enum EmployerStatus {
    OK("ok"),
    YUCK("yuck"),
    NEVER("never");

    private final String code;

    EmployerStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static EmployerStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OK;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EmployerStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown employer status: " + code);
    }
}
