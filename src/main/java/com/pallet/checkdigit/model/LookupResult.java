package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for a station lookup, also the payload applied to a lookup session.
 */
public record LookupResult(

        @JsonProperty("buildingId")
        int buildingId,

        /**
         * Input exactly as the operator typed it.
         */
        @JsonProperty("input")
        String input,

        @JsonProperty("classification")
        ValidationClass classification,

        /**
         * Output of {@code normalize(input)}; canonical only when the input was resolvable.
         */
        @JsonProperty("normalized")
        String normalized,

        @JsonProperty("status")
        LookupStatus status,

        /**
         * Check digit for FOUND results, otherwise null.
         */
        @JsonProperty("checkDigit")
        String checkDigit,

        /**
         * Short operator-facing form (e.g. {@code 58-1}); null when not resolvable.
         */
        @JsonProperty("displayForm")
        String displayForm,

        /**
         * Verbose terminal form (e.g. {@code 3-58-01-1}); null when not resolvable.
         */
        @JsonProperty("fullForm")
        String fullForm,

        @JsonProperty("suggestions")
        List<String> suggestions

) {

    public boolean found() {
        return status == LookupStatus.FOUND;
    }
}
