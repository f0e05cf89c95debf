package com.pallet.checkdigit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Plain Java bean representing a row in the {@code station_check_digit} table.
 *
 * One row exists per (buildingId, stationKey) pair. Writes on an existing pair replace
 * the check digit and description; {@code usageCount} survives edits and is only reset
 * by an explicit re-import wipe.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StationRecord {

    /** Warehouse building the station belongs to. */
    private int buildingId;

    /** Canonical {@code AA-PP} station key. */
    private String stationKey;

    /** Confirmation code the forklift terminal expects (1-3 digits, {@code "00"} is valid). */
    private String checkDigit;

    /** Optional free text; empty string when absent. */
    @Builder.Default
    private String description = "";

    /** Number of successful lookups/deliveries, drives quick-access ranking. */
    private int usageCount;

    /** Last write time. */
    private Instant lastUpdated;

    /**
     * Convenience accessor for the parsed key.
     *
     * @return the key, or {@code null} if {@link #stationKey} is not canonical
     */
    public StationKey key() {
        return StationKey.parse(stationKey).orElse(null);
    }
}
