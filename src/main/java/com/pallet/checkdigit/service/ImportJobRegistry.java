package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.ImportReport;
import com.pallet.checkdigit.model.Outcome;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs bulk imports off the request thread and keeps their progress for polling.
 *
 * Finished jobs beyond {@code stations.import.max-retained-jobs} are forgotten, oldest first.
 */
@Singleton
public class ImportJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(ImportJobRegistry.class);

    @Value("${stations.import.max-retained-jobs:20}")
    int maxRetainedJobs = 20;

    private final StationImportService importService;
    private final ExecutorService executor;
    private final Map<String, ImportJob> jobs = new ConcurrentHashMap<>();

    @Inject
    public ImportJobRegistry(StationImportService importService,
                             @Named(TaskExecutors.IO) ExecutorService executor) {
        this.importService = importService;
        this.executor = executor;
    }

    /**
     * Starts a CSV import in the background.
     *
     * @param csv             delimited text, header first
     * @param defaultBuilding building for rows without a building column
     * @param replaceExisting wipe touched buildings first
     * @return the job, already registered for polling
     */
    public ImportJob submit(String csv, int defaultBuilding, boolean replaceExisting) {
        ImportJob job = new ImportJob(UUID.randomUUID().toString(), Instant.now());
        jobs.put(job.getId(), job);
        prune();

        log.info("Submitting import job id={} defaultBuilding={} replace={} chars={}",
                job.getId(), defaultBuilding, replaceExisting, csv == null ? 0 : csv.length());
        try {
            executor.execute(() -> run(job, csv, defaultBuilding, replaceExisting));
        } catch (RejectedExecutionException e) {
            log.error("Import job id={} rejected by executor", job.getId(), e);
            job.complete(Outcome.failed("Import could not be started, try again", e));
        }
        return job;
    }

    public Optional<ImportJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void run(ImportJob job, String csv, int defaultBuilding, boolean replaceExisting) {
        Outcome<ImportReport> outcome;
        try {
            outcome = importService.importCsv(new StringReader(csv == null ? "" : csv),
                    defaultBuilding, replaceExisting, job);
        } catch (RuntimeException e) {
            log.error("Import job id={} failed unexpectedly", job.getId(), e);
            outcome = Outcome.failed("Import failed: " + e.getMessage(), e);
        }
        job.complete(outcome);
        log.info("Import job id={} finished state={} processed={} total={}",
                job.getId(), job.getState(), job.getProcessed(), job.getTotal());
    }

    private void prune() {
        int excess = jobs.size() - maxRetainedJobs;
        if (excess <= 0) {
            return;
        }
        jobs.values().stream()
                .filter(ImportJob::isFinished)
                .sorted(Comparator.comparing(ImportJob::getSubmittedAt))
                .limit(excess)
                .map(ImportJob::getId)
                .toList()
                .forEach(jobs::remove);
    }
}
