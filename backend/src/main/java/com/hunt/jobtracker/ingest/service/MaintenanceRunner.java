package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import com.hunt.jobtracker.ingest.model.CleanupSummary;
import com.hunt.jobtracker.ingest.model.DescriptionFetchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceRunner.class);

    private final HuntProperties properties;
    private final CleanupService cleanupService;
    private final DescriptionFetchService descriptionFetchService;
    private final ConfigurableApplicationContext applicationContext;

    public MaintenanceRunner(
        HuntProperties properties,
        CleanupService cleanupService,
        DescriptionFetchService descriptionFetchService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.cleanupService = cleanupService;
        this.descriptionFetchService = descriptionFetchService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        HuntProperties.Maintenance maintenance = properties.getMaintenance();
        if (!maintenance.isRun()) {
            return;
        }

        boolean dryRun = maintenance.isDryRun();
        int artifacts = maintenance.isArtifacts() ? cleanupService.cleanupArtifacts(dryRun) : 0;
        int duplicates = maintenance.isDuplicates() ? cleanupService.cleanupDuplicates(dryRun) : 0;
        CleanupSummary summary = new CleanupSummary(artifacts, duplicates, dryRun);
        log.info(
            "Maintenance completed{}: artifacts={}, duplicates={}",
            summary.dryRun() ? " [dry-run]" : "",
            summary.artifactsRemoved(),
            summary.duplicatesRemoved()
        );

        if (maintenance.isDescriptions()) {
            DescriptionFetchSummary fetched = descriptionFetchService.fetchMissing();
            log.info("Maintenance description fetch: succeeded={}, failed={}", fetched.succeeded(), fetched.failed());
        }

        if (maintenance.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
