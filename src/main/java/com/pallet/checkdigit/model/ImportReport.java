package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Partial-success summary of a bulk import.
 *
 * {@code inserted + skipped == totalRows}. Every skipped row has an entry in {@code failures}.
 */
public record ImportReport(

        @JsonProperty("totalRows")
        int totalRows,

        @JsonProperty("inserted")
        int inserted,

        @JsonProperty("skipped")
        int skipped,

        @JsonProperty("failures")
        List<ImportFailure> failures

) {
}
