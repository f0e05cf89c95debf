package com.pallet.checkdigit.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for the lookup-session endpoints.
 */
public record LookupSessionView(

        @JsonProperty("sessionId")
        String sessionId,

        @JsonProperty("state")
        LookupState state

) {

    public static LookupSessionView of(LookupSession session, LookupState state) {
        return new LookupSessionView(session.getId(), state);
    }
}
