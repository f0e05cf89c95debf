package com.pallet.checkdigit.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pallet.checkdigit.model.LookupResult;
import com.pallet.checkdigit.model.LookupStatus;
import com.pallet.checkdigit.model.ValidationClass;
import com.pallet.checkdigit.normalizer.StationNormalizer;

import java.util.List;

/**
 * Immutable snapshot of a lookup session. Every event produces a new state through one of
 * the {@code with*} transitions; none of them has side effects.
 *
 * {@code ticket} is the id of the lookup the state is waiting for (0 when none). A lookup
 * result is only accepted by a state that still waits for that ticket and still holds the
 * same building and input, so a late answer for superseded input is dropped.
 */
public record LookupState(

        @JsonProperty("buildingId")
        int buildingId,

        @JsonProperty("input")
        String input,

        @JsonProperty("classification")
        ValidationClass classification,

        @JsonProperty("normalized")
        String normalized,

        @JsonProperty("suggestions")
        List<String> suggestions,

        @JsonProperty("phase")
        LookupPhase phase,

        @JsonProperty("checkDigit")
        String checkDigit,

        @JsonProperty("displayForm")
        String displayForm,

        @JsonProperty("fullForm")
        String fullForm,

        @JsonProperty("message")
        String message,

        @JsonIgnore
        long ticket,

        /**
         * Incremented by every transition that changes input or building.
         */
        @JsonProperty("revision")
        long revision

) {

    public static LookupState initial(int buildingId) {
        return new LookupState(buildingId, "", ValidationClass.EMPTY, "",
                StationNormalizer.suggest("", buildingId), LookupPhase.IDLE,
                null, null, null, ValidationClass.EMPTY.getMessage(), 0L, 0L);
    }

    /**
     * New input text after a keystroke. Any previous result is cleared.
     */
    public LookupState withInput(String raw) {
        String text = raw == null ? "" : raw.strip();
        return typed(buildingId, text, revision + 1);
    }

    /**
     * Building switch: keeps the input, drops any result obtained for the old building.
     */
    public LookupState withBuilding(int newBuildingId) {
        return typed(newBuildingId, input, revision + 1);
    }

    public LookupState cleared() {
        LookupState fresh = initial(buildingId);
        return new LookupState(fresh.buildingId, fresh.input, fresh.classification, fresh.normalized,
                fresh.suggestions, fresh.phase, null, null, null, fresh.message, 0L, revision + 1);
    }

    public LookupState lookupStarted(long ticketId) {
        return new LookupState(buildingId, input, classification, normalized, suggestions,
                LookupPhase.LOOKING_UP, null, null, null, "Looking up...", ticketId, revision);
    }

    /**
     * @return true if a result for {@code t} may still be applied to this state
     */
    public boolean accepts(LookupTicket t) {
        return ticket != 0L
                && t.id() == ticket
                && t.buildingId() == buildingId
                && t.input().equals(input);
    }

    /**
     * Applies a lookup result, or returns {@code this} unchanged if the ticket is stale.
     */
    public LookupState withResult(LookupTicket t, LookupResult result) {
        if (!accepts(t)) {
            return this;
        }
        if (result.status() == LookupStatus.NOT_RESOLVABLE) {
            return typed(buildingId, input, revision);
        }
        boolean found = result.status() == LookupStatus.FOUND;
        return new LookupState(buildingId, input, classification, result.normalized(), suggestions,
                found ? LookupPhase.FOUND : LookupPhase.NOT_FOUND,
                result.checkDigit(), result.displayForm(), result.fullForm(),
                found ? "Check digit " + result.checkDigit() : "Not found, enter check digit manually",
                0L, revision);
    }

    /**
     * Records a failed lookup, or returns {@code this} unchanged if the ticket is stale.
     */
    public LookupState withFailure(LookupTicket t, String failureMessage) {
        if (!accepts(t)) {
            return this;
        }
        return new LookupState(buildingId, input, classification, normalized, suggestions,
                LookupPhase.FAILED, null, null, null, failureMessage, 0L, revision);
    }

    public boolean isResolvable() {
        return classification.isResolvable();
    }

    private static LookupState typed(int buildingId, String text, long revision) {
        ValidationClass classification = StationNormalizer.classify(text);
        LookupPhase phase = classification == ValidationClass.EMPTY ? LookupPhase.IDLE : LookupPhase.TYPING;
        return new LookupState(buildingId, text, classification, StationNormalizer.normalize(text),
                StationNormalizer.suggest(text, buildingId), phase,
                null, null, null, classification.getMessage(), 0L, revision);
    }
}
