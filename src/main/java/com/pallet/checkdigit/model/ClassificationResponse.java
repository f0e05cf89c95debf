package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code GET /api/stations/classify}.
 */
public record ClassificationResponse(

        @JsonProperty("input")
        String input,

        @JsonProperty("classification")
        ValidationClass classification,

        @JsonProperty("resolvable")
        boolean resolvable,

        @JsonProperty("message")
        String message,

        @JsonProperty("normalized")
        String normalized,

        @JsonProperty("suggestions")
        List<String> suggestions

) {
}
