package com.hunt.jobtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hunt")
public class HuntProperties {
    private static final String DEFAULT_USER_AGENT = "hunt-jobtracker/0.1 (+personal job search)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private Fetch fetch = new Fetch();
    private Ingest ingest = new Ingest();
    private Maintenance maintenance = new Maintenance();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    private static String normalizeUserAgent(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return value.trim();
    }

    public static class Fetch {
        private double delaySeconds = 5.0;
        private double jitterRatio = 0.2;
        private int limit = 0;
        private boolean force = false;

        public double getDelaySeconds() {
            return delaySeconds;
        }

        public void setDelaySeconds(double delaySeconds) {
            this.delaySeconds = Math.max(0.0, delaySeconds);
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = Math.min(1.0, Math.max(0.0, jitterRatio));
        }

        public int getLimit() {
            return limit;
        }

        /** Zero or less fetches every eligible record. */
        public void setLimit(int limit) {
            this.limit = Math.max(0, limit);
        }

        public boolean isForce() {
            return force;
        }

        public void setForce(boolean force) {
            this.force = force;
        }
    }

    public static class Ingest {
        private boolean dryRun = false;

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }
    }

    public static class Maintenance {
        private boolean run = false;
        private boolean artifacts = true;
        private boolean duplicates = true;
        private boolean descriptions = false;
        private boolean dryRun = false;
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isArtifacts() {
            return artifacts;
        }

        public void setArtifacts(boolean artifacts) {
            this.artifacts = artifacts;
        }

        public boolean isDuplicates() {
            return duplicates;
        }

        public void setDuplicates(boolean duplicates) {
            this.duplicates = duplicates;
        }

        public boolean isDescriptions() {
            return descriptions;
        }

        public void setDescriptions(boolean descriptions) {
            this.descriptions = descriptions;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
