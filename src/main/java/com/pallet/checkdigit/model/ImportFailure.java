package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single rejected import row.
 */
public record ImportFailure(

        @JsonProperty("rowNumber")
        int rowNumber,

        @JsonProperty("reason")
        String reason

) {
}
