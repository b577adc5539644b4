package com.hunt.jobtracker.ingest.model;

public enum AdmissionStatus {
    ADDED,
    DUPLICATE,
    DRY_RUN
}
