package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.*;
import com.pallet.checkdigit.normalizer.StationNormalizer;
import com.pallet.checkdigit.repository.StationRepository;
import com.pallet.checkdigit.repository.StationStorageException;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.*;

/**
 * Bulk import of station check digits.
 *
 * <p>The batch runs in one transaction: the optional wipe and every upsert commit together
 * or roll back together on a storage failure. Each row is normalized on its own; a bad row
 * is recorded and the batch carries on. Rows are rejected when:
 * <ul>
 *   <li>the station or the check digit is missing (fewer than two usable fields)</li>
 *   <li>the station text is not a complete station key</li>
 *   <li>the check digit is not 1-3 digits</li>
 *   <li>the row names a building outside {@code stations.buildings}</li>
 *   <li>the row could not be written</li>
 * </ul>
 *
 * <p>An empty batch is reported as INVALID, which is different from a successful report
 * that inserted nothing.
 */
@Singleton
public class StationImportService {

    private static final Logger log = LoggerFactory.getLogger(StationImportService.class);

    @Value("${stations.preserve-usage-on-upsert:true}")
    boolean preserveUsageOnUpsert = true;

    @Value("${stations.import.progress-log-every:50}")
    int progressLogEvery = 50;

    private final StationRepository repository;
    private final BuildingRegistry buildings;
    private final StationCsvReader csvReader;

    @Inject
    public StationImportService(StationRepository repository, BuildingRegistry buildings, StationCsvReader csvReader) {
        this.repository = repository;
        this.buildings = buildings;
        this.csvReader = csvReader;
    }

    /**
     * Reads CSV text and imports it.
     *
     * @param source          delimited text, header first
     * @param defaultBuilding building for rows without a building column
     * @param replaceExisting wipe every building the batch touches before inserting
     * @param listener        progress callback
     * @return the import report, INVALID for unreadable or empty input, FAILED on storage error
     */
    public Outcome<ImportReport> importCsv(Reader source, int defaultBuilding, boolean replaceExisting,
                                           ImportProgressListener listener) {
        List<ImportRow> rows;
        try {
            rows = csvReader.read(source);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read station CSV: {}", e.getMessage());
            return Outcome.invalid("Could not read CSV: " + e.getMessage());
        }
        return importRows(defaultBuilding, rows, replaceExisting, listener);
    }

    /**
     * Imports already-split rows.
     *
     * @param defaultBuilding building for rows that carry none
     * @param rows            rows to import
     * @param replaceExisting wipe every building the batch touches before inserting; this
     *                        is the only path that resets usage counts
     * @param listener        progress callback, invoked after every row
     * @return report with inserted/skipped counts and per-row failure reasons
     */
    public Outcome<ImportReport> importRows(int defaultBuilding, List<ImportRow> rows, boolean replaceExisting,
                                            ImportProgressListener listener) {
        if (!buildings.isKnown(defaultBuilding)) {
            return Outcome.invalid("Unknown building " + defaultBuilding + ", expected one of " + buildings.getBuildings());
        }
        if (rows == null || rows.isEmpty()) {
            log.warn("Import called with no station rows building={}", defaultBuilding);
            return Outcome.invalid("No station rows found to import");
        }
        ImportProgressListener progress = listener == null ? ImportProgressListener.NONE : listener;

        log.info("Starting station import rows={} defaultBuilding={} replace={}",
                rows.size(), defaultBuilding, replaceExisting);

        List<ImportFailure> failures = new ArrayList<>();
        int inserted = 0;
        int processed = 0;
        Instant now = Instant.now();

        try (Connection conn = repository.getDataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (replaceExisting) {
                    wipeTouchedBuildings(conn, defaultBuilding, rows);
                }
                for (ImportRow row : rows) {
                    String reason = importRow(conn, row, defaultBuilding, replaceExisting, now);
                    if (reason == null) {
                        inserted++;
                    } else {
                        failures.add(new ImportFailure(row.rowNumber(), reason));
                        log.warn("Skipping import row {}: {}", row.rowNumber(), reason);
                    }
                    processed++;
                    progress.onProgress(processed, rows.size());
                    if (progressLogEvery > 0 && processed % progressLogEvery == 0) {
                        log.info("Import progress processed={} total={} inserted={}", processed, rows.size(), inserted);
                    }
                }
                conn.commit();
            } catch (SQLException | StationStorageException e) {
                rollback(conn);
                log.error("Station import rolled back after {} rows", processed, e);
                return Outcome.failed("Station storage unavailable, import rolled back", e);
            }
        } catch (SQLException e) {
            log.error("Error acquiring connection for import", e);
            return Outcome.failed("Station storage unavailable, nothing imported", e);
        }

        ImportReport report = new ImportReport(rows.size(), inserted, failures.size(), List.copyOf(failures));
        log.info("Station import finished total={} inserted={} skipped={}",
                report.totalRows(), report.inserted(), report.skipped());
        return Outcome.ok(report);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    /**
     * @return null on success, otherwise the reason the row was skipped
     */
    private String importRow(Connection conn, ImportRow row, int defaultBuilding, boolean replaceExisting, Instant now) {
        String stationText = row.stationText() == null ? "" : row.stationText().trim();
        String checkDigit = row.checkDigit() == null ? "" : row.checkDigit().trim();

        if (stationText.isEmpty() || checkDigit.isEmpty()) {
            return "Missing station or check digit";
        }

        int buildingId = row.buildingId() == null ? defaultBuilding : row.buildingId();
        if (!buildings.isKnown(buildingId)) {
            return "Unknown building " + buildingId;
        }

        Optional<StationKey> key = StationNormalizer.toKey(stationText);
        if (key.isEmpty()) {
            return "Invalid station '" + stationText + "' (" + StationNormalizer.classify(stationText) + ")";
        }
        if (!StationLookupService.isValidCheckDigit(checkDigit)) {
            return "Invalid check digit '" + checkDigit + "'";
        }

        StationRecord station = StationRecord.builder()
                .buildingId(buildingId)
                .stationKey(key.get().canonical())
                .checkDigit(checkDigit)
                .description(row.description() == null ? "" : row.description().trim())
                .usageCount(0)
                .lastUpdated(now)
                .build();

        try {
            repository.upsert(conn, station, preserveUsageOnUpsert && !replaceExisting);
            return null;
        } catch (StationStorageException e) {
            return "Storage error: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    private void wipeTouchedBuildings(Connection conn, int defaultBuilding, List<ImportRow> rows) {
        Set<Integer> touched = new TreeSet<>();
        for (ImportRow row : rows) {
            int buildingId = row.buildingId() == null ? defaultBuilding : row.buildingId();
            if (buildings.isKnown(buildingId)) {
                touched.add(buildingId);
            }
        }
        int removed = 0;
        for (int buildingId : touched) {
            removed += repository.deleteAllByBuilding(conn, buildingId);
        }
        log.info("Re-import wipe buildings={} removed={}", touched, removed);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.error("Rollback failed for station import", rollbackEx);
        }
    }
}
