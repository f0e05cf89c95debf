package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Introspected;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound payload for {@code PUT /api/lookup-sessions/{id}/input}: the full text of the input
 * field after the latest keystroke.
 */
@Introspected
public record SessionInputRequest(

        @NotNull(message = "input must not be null")
        @JsonProperty("input")
        String input

) {
}
