package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Introspected;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound payload for creating a lookup session or switching its building.
 */
@Introspected
public record SessionBuildingRequest(

        @NotNull(message = "buildingId must not be null")
        @JsonProperty("buildingId")
        Integer buildingId

) {
}
