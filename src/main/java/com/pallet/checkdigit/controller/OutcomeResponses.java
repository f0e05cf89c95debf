package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.model.ErrorResponse;
import com.pallet.checkdigit.model.Outcome;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;

/**
 * Maps service outcomes to HTTP responses: OK to 200, INVALID to 400, FAILED to 503.
 */
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static <T> HttpResponse<?> toResponse(Outcome<T> outcome) {
        return switch (outcome.status()) {
            case OK -> HttpResponse.ok(outcome.value());
            case INVALID -> HttpResponse.badRequest(new ErrorResponse(outcome.message(), false));
            case FAILED -> HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse(outcome.message(), true));
        };
    }
}
