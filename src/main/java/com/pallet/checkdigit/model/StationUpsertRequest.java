package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Introspected;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Inbound payload for {@code PUT /api/stations/{buildingId}/{key}}.
 *
 * The station key itself comes from the path and may be typed in any accepted shorthand.
 */
@Introspected
public record StationUpsertRequest(

        /**
         * Confirmation code shown next to the station; one to three digits.
         */
        @NotBlank(message = "checkDigit must not be blank")
        @Pattern(regexp = "\\s*[0-9]{1,3}\\s*", message = "checkDigit must be 1-3 digits")
        @JsonProperty("checkDigit")
        String checkDigit,

        @Size(max = 255, message = "description must be at most 255 characters")
        @JsonProperty("description")
        String description

) {
}
