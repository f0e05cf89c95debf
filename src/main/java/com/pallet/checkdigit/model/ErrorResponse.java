package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for INVALID (400) and FAILED (503) outcomes.
 */
public record ErrorResponse(

        @JsonProperty("message")
        String message,

        /**
         * True when the same request may succeed later (storage failures).
         */
        @JsonProperty("retryable")
        boolean retryable

) {
}
