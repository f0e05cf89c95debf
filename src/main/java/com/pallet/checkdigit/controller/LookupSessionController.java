package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.model.ErrorResponse;
import com.pallet.checkdigit.model.Outcome;
import com.pallet.checkdigit.model.SessionBuildingRequest;
import com.pallet.checkdigit.model.SessionInputRequest;
import com.pallet.checkdigit.service.BuildingRegistry;
import com.pallet.checkdigit.session.LookupSession;
import com.pallet.checkdigit.session.LookupSessionRegistry;
import com.pallet.checkdigit.session.LookupSessionView;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keystroke-driven lookup sessions for handheld input fields.
 *
 * Base path: {@code /api/lookup-sessions}
 *
 * Endpoints:
 * <ul>
 *   <li>{@code POST   /api/lookup-sessions?buildingId=}   - open a session</li>
 *   <li>{@code PUT    /api/lookup-sessions/{id}/input}    - field text after a keystroke</li>
 *   <li>{@code PUT    /api/lookup-sessions/{id}/building} - switch building</li>
 *   <li>{@code POST   /api/lookup-sessions/{id}/lookup}   - explicit submit or retry</li>
 *   <li>{@code DELETE /api/lookup-sessions/{id}/input}    - clear the field</li>
 *   <li>{@code GET    /api/lookup-sessions/{id}}          - current state</li>
 *   <li>{@code DELETE /api/lookup-sessions/{id}}          - close</li>
 * </ul>
 *
 * Lookups run in the background; a response may show phase LOOKING_UP and the caller polls
 * {@code GET /{id}} for the result.
 */
@Controller("/api/lookup-sessions")
public class LookupSessionController {

    private static final Logger log = LoggerFactory.getLogger(LookupSessionController.class);

    @Inject
    private LookupSessionRegistry sessions;

    @Inject
    private BuildingRegistry buildings;

    @Post
    public HttpResponse<?> open(@Nullable @QueryValue Integer buildingId) {
        Outcome<LookupSession> opened = sessions.open(buildingId);
        if (!opened.isOk()) {
            return OutcomeResponses.toResponse(opened);
        }
        LookupSession session = opened.value();
        log.info("POST /api/lookup-sessions id={} building={}", session.getId(), session.current().buildingId());
        return HttpResponse.created(LookupSessionView.of(session, session.current()));
    }

    @Put("/{sessionId}/input")
    public LookupSessionView updateInput(@PathVariable String sessionId, @Body @Valid SessionInputRequest request) {
        LookupSession session = require(sessionId);
        return LookupSessionView.of(session, session.updateInput(request.input()));
    }

    @Put("/{sessionId}/building")
    public HttpResponse<?> selectBuilding(@PathVariable String sessionId, @Body @Valid SessionBuildingRequest request) {
        LookupSession session = require(sessionId);
        if (!buildings.isKnown(request.buildingId())) {
            return HttpResponse.badRequest(new ErrorResponse(
                    "Unknown building " + request.buildingId() + ", expected one of " + buildings.getBuildings(), false));
        }
        log.info("PUT /api/lookup-sessions/{}/building buildingId={}", sessionId, request.buildingId());
        return HttpResponse.ok(LookupSessionView.of(session, session.selectBuilding(request.buildingId())));
    }

    @Post("/{sessionId}/lookup")
    public LookupSessionView lookupNow(@PathVariable String sessionId) {
        LookupSession session = require(sessionId);
        return LookupSessionView.of(session, session.lookupNow());
    }

    @Delete("/{sessionId}/input")
    public LookupSessionView clear(@PathVariable String sessionId) {
        LookupSession session = require(sessionId);
        return LookupSessionView.of(session, session.clear());
    }

    @Get("/{sessionId}")
    public LookupSessionView current(@PathVariable String sessionId) {
        LookupSession session = require(sessionId);
        return LookupSessionView.of(session, session.current());
    }

    @Delete("/{sessionId}")
    @Status(HttpStatus.NO_CONTENT)
    public void close(@PathVariable String sessionId) {
        if (!sessions.close(sessionId)) {
            throw new HttpStatusException(HttpStatus.NOT_FOUND, "No lookup session " + sessionId);
        }
    }

    private LookupSession require(String sessionId) {
        return sessions.find(sessionId)
                .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "No lookup session " + sessionId));
    }
}
