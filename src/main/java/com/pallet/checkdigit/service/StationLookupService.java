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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Core lookup and maintenance service for station check digits.
 *
 * Responsibilities:
 * <ul>
 *   <li>Combine the normalizer with the repository: classify raw input, canonicalise it
 *       and resolve it against one building's table</li>
 *   <li>Validate caller input (building ids, check digits, station keys) before writes</li>
 *   <li>Turn storage failures into {@link Outcome#failed} results so that no database
 *       problem escapes to the caller as an exception</li>
 * </ul>
 *
 * A miss is a normal {@link LookupStatus#NOT_FOUND} result, not an error.
 */
@Singleton
public class StationLookupService {

    private static final Logger log = LoggerFactory.getLogger(StationLookupService.class);

    private static final Pattern CHECK_DIGIT = Pattern.compile("[0-9]{1,3}");
    private static final Pattern AISLE = Pattern.compile("[0-9]{1,2}");

    static final String STORAGE_UNAVAILABLE = "Station storage unavailable, try again";

    private final StationRepository repository;
    private final BuildingRegistry buildings;

    @Value("${stations.preserve-usage-on-upsert:true}")
    boolean preserveUsageOnUpsert = true;

    @Inject
    public StationLookupService(StationRepository repository, BuildingRegistry buildings) {
        this.repository = repository;
        this.buildings = buildings;
    }

    // -----------------------------------------------------------------------
    // Lookup
    // -----------------------------------------------------------------------

    /**
     * Classifies, normalizes and, when the input is complete, resolves it.
     *
     * @param buildingId building to resolve in
     * @param raw        operator input
     * @return OK with the lookup result (FOUND, NOT_FOUND or NOT_RESOLVABLE), INVALID for an
     *         unknown building, FAILED when storage is unavailable
     */
    public Outcome<LookupResult> lookup(int buildingId, String raw) {
        return lookup(buildingId, raw, false);
    }

    /**
     * As {@link #lookup(int, String)}, optionally counting a hit towards quick-access ranking.
     *
     * @param recordUsage increment the usage counter when the station is found
     */
    public Outcome<LookupResult> lookup(int buildingId, String raw, boolean recordUsage) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }

        ValidationClass classification = StationNormalizer.classify(raw);
        String normalized = StationNormalizer.normalize(raw);
        List<String> suggestions = StationNormalizer.suggest(raw, buildingId);

        Optional<StationKey> key = StationNormalizer.toKey(raw);
        if (key.isEmpty()) {
            log.debug("lookup not resolvable building={} input='{}' class={}", buildingId, raw, classification);
            return Outcome.ok(new LookupResult(buildingId, raw, classification, normalized,
                    LookupStatus.NOT_RESOLVABLE, null, null, null, suggestions));
        }

        StationKey stationKey = key.get();
        return guard("lookup", () -> {
            Optional<String> checkDigit = repository.findCheckDigit(buildingId, stationKey.canonical());
            if (checkDigit.isPresent() && recordUsage) {
                try {
                    repository.incrementUsage(buildingId, stationKey.canonical());
                } catch (StationStorageException e) {
                    log.warn("lookup building={} key={} could not record usage: {}",
                            buildingId, stationKey, e.getMessage());
                }
            }
            log.info("lookup building={} input='{}' key={} found={}",
                    buildingId, raw, stationKey, checkDigit.isPresent());
            return new LookupResult(buildingId, raw, classification, stationKey.canonical(),
                    checkDigit.isPresent() ? LookupStatus.FOUND : LookupStatus.NOT_FOUND,
                    checkDigit.orElse(null),
                    StationNormalizer.displayForm(stationKey),
                    StationNormalizer.fullForm(buildingId, stationKey),
                    suggestions);
        });
    }

    /**
     * Resolves an already-canonical key.
     *
     * @return OK with the check digit, or OK with empty for a miss
     */
    public Outcome<Optional<String>> resolve(int buildingId, StationKey key) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        return guard("resolve", () -> repository.findCheckDigit(buildingId, key.canonical()));
    }

    /**
     * Counts one use of a station. Unknown stations are left alone; no row is created.
     *
     * @param stationText key in any accepted shorthand
     * @return OK(true) if a counter moved, OK(false) if the station does not exist
     */
    public Outcome<Boolean> recordUsage(int buildingId, String stationText) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        Optional<StationKey> key = StationNormalizer.toKey(stationText);
        if (key.isEmpty()) {
            return Outcome.ok(false);
        }
        return guard("recordUsage", () -> repository.incrementUsage(buildingId, key.get().canonical()));
    }

    // -----------------------------------------------------------------------
    // Maintenance
    // -----------------------------------------------------------------------

    /**
     * Adds or edits a station. Usage count is preserved on edits unless
     * {@code stations.preserve-usage-on-upsert} is false.
     *
     * @param stationText key in any accepted shorthand
     * @param checkDigit  one to three digits
     * @param description optional free text
     * @return OK with the stored row, INVALID for bad input, FAILED on storage error
     */
    public Outcome<StationRecord> upsert(int buildingId, String stationText, String checkDigit, String description) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        Optional<StationKey> key = StationNormalizer.toKey(stationText);
        if (key.isEmpty()) {
            return Outcome.invalid("Invalid station '" + stationText + "': "
                    + StationNormalizer.classify(stationText).getMessage());
        }
        String digit = checkDigit == null ? "" : checkDigit.trim();
        if (!isValidCheckDigit(digit)) {
            return Outcome.invalid("Check digit must be 1-3 digits, got '" + checkDigit + "'");
        }

        StationRecord station = StationRecord.builder()
                .buildingId(buildingId)
                .stationKey(key.get().canonical())
                .checkDigit(digit)
                .description(description == null ? "" : description.trim())
                .usageCount(0)
                .lastUpdated(Instant.now())
                .build();

        return guard("upsert", () -> {
            boolean inserted = repository.upsert(station, preserveUsageOnUpsert);
            log.info("upsert building={} key={} inserted={}", buildingId, station.getStationKey(), inserted);
            return repository.find(buildingId, station.getStationKey()).orElse(station);
        });
    }

    public Outcome<Boolean> delete(int buildingId, String stationText) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        Optional<StationKey> key = StationNormalizer.toKey(stationText);
        if (key.isEmpty()) {
            return Outcome.invalid("Invalid station '" + stationText + "'");
        }
        return guard("delete", () -> repository.delete(buildingId, key.get().canonical()));
    }

    public Outcome<Integer> deleteAll(int buildingId) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        return guard("deleteAll", () -> repository.deleteAllByBuilding(buildingId));
    }

    /** Global wipe across every building. */
    public Outcome<Integer> deleteEverything() {
        return guard("deleteEverything", repository::deleteAll);
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public Outcome<List<StationRecord>> listAll(int buildingId) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        return guard("listAll", () -> repository.findAllByBuilding(buildingId));
    }

    /**
     * Case-insensitive match on key text, description or check digit. A blank term
     * returns the whole building.
     */
    public Outcome<List<StationRecord>> search(int buildingId, String term) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return listAll(buildingId);
        }
        return guard("search", () -> repository.search(buildingId, trimmed));
    }

    /**
     * Stations of one aisle ordered by position. {@code "5"} and {@code "05"} are the same aisle.
     */
    public Outcome<List<StationRecord>> byAisle(int buildingId, String aisle) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        String trimmed = aisle == null ? "" : aisle.trim();
        if (!AISLE.matcher(trimmed).matches()) {
            return Outcome.invalid("Aisle must be 1-2 digits, got '" + aisle + "'");
        }
        String padded = trimmed.length() == 1 ? "0" + trimmed : trimmed;
        return guard("byAisle", () -> repository.findByAisle(buildingId, padded));
    }

    /**
     * Stations with a non-zero usage count, most used first.
     */
    public Outcome<List<StationRecord>> mostUsed(int buildingId, int limit) {
        return mostUsed(buildingId, 1, limit);
    }

    Outcome<List<StationRecord>> mostUsed(int buildingId, int minUsage, int limit) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        if (limit <= 0) {
            return Outcome.ok(List.of());
        }
        return guard("mostUsed", () -> repository.findMostUsed(buildingId, minUsage, limit));
    }

    public Outcome<Integer> count(int buildingId) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        return guard("count", () -> repository.count(buildingId));
    }

    public Outcome<Integer> countAll() {
        return guard("countAll", repository::countAll);
    }

    public Outcome<Boolean> exists(int buildingId, String stationText) {
        if (!buildings.isKnown(buildingId)) {
            return unknownBuilding(buildingId);
        }
        Optional<StationKey> key = StationNormalizer.toKey(stationText);
        if (key.isEmpty()) {
            return Outcome.ok(false);
        }
        return guard("exists", () -> repository.exists(buildingId, key.get().canonical()));
    }

    public static boolean isValidCheckDigit(String checkDigit) {
        return checkDigit != null && CHECK_DIGIT.matcher(checkDigit).matches();
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private <T> Outcome<T> guard(String operation, Supplier<T> action) {
        try {
            return Outcome.ok(action.get());
        } catch (StationStorageException e) {
            log.error("{} failed in storage operation {}: {}", operation, e.getOperation(), e.getMessage());
            return Outcome.failed(STORAGE_UNAVAILABLE, e);
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly: {}", operation, e.getMessage(), e);
            return Outcome.failed(STORAGE_UNAVAILABLE, e);
        }
    }

    private <T> Outcome<T> unknownBuilding(int buildingId) {
        return Outcome.invalid("Unknown building " + buildingId + ", expected one of " + buildings.getBuildings());
    }
}
