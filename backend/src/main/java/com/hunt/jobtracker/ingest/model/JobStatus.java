package com.hunt.jobtracker.ingest.model;

import java.util.Locale;

public enum JobStatus {
    NEW("new"),
    REVIEWING("reviewing"),
    APPLIED("applied"),
    REJECTED("rejected"),
    CLOSED("closed");

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Closed and rejected postings are out of the running. */
    public boolean isOpen() {
        return this != REJECTED && this != CLOSED;
    }

    public static JobStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NEW;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }
}
