package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Quick-access lists for one building, derived from usage counts.
 */
public record QuickAccessView(

        @JsonProperty("buildingId")
        int buildingId,

        /**
         * Stations used at least once, most used first.
         */
        @JsonProperty("recent")
        List<StationRecord> recent,

        /**
         * Stations used often enough to pin, most used first.
         */
        @JsonProperty("frequent")
        List<StationRecord> frequent

) {
}
