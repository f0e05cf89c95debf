package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.model.ClassificationResponse;
import com.pallet.checkdigit.model.StationUpsertRequest;
import com.pallet.checkdigit.model.ValidationClass;
import com.pallet.checkdigit.normalizer.StationNormalizer;
import com.pallet.checkdigit.service.QuickAccessService;
import com.pallet.checkdigit.service.StationLookupService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST controller for station check-digit lookup and maintenance.
 *
 * Base path: {@code /api/stations}
 *
 * Endpoints:
 * <ul>
 *   <li>{@code GET    /api/stations/classify?input=}                  - classify raw input</li>
 *   <li>{@code GET    /api/stations/{buildingId}/lookup?input=}       - one-shot lookup</li>
 *   <li>{@code GET    /api/stations/{buildingId}}                     - all stations, most used first</li>
 *   <li>{@code GET    /api/stations/{buildingId}/search?q=}           - substring search</li>
 *   <li>{@code GET    /api/stations/{buildingId}/aisle/{aisle}}       - one aisle by position</li>
 *   <li>{@code GET    /api/stations/{buildingId}/most-used?limit=}    - usage ranking</li>
 *   <li>{@code GET    /api/stations/{buildingId}/quick-access}        - recent and frequent lists</li>
 *   <li>{@code GET    /api/stations/{buildingId}/count}               - number of stations</li>
 *   <li>{@code GET    /api/stations/{buildingId}/{key}/exists}        - existence check</li>
 *   <li>{@code PUT    /api/stations/{buildingId}/{key}}               - add or edit</li>
 *   <li>{@code POST   /api/stations/{buildingId}/{key}/usage}         - count one use</li>
 *   <li>{@code DELETE /api/stations/{buildingId}/{key}}               - delete one</li>
 *   <li>{@code DELETE /api/stations/{buildingId}}                     - delete a building</li>
 *   <li>{@code DELETE /api/stations}                                  - delete everything</li>
 * </ul>
 *
 * A lookup miss is a 200 with status NOT_FOUND.
 */
@Controller("/api/stations")
public class StationController {

    private static final Logger log = LoggerFactory.getLogger(StationController.class);

    @Inject
    private StationLookupService lookupService;

    @Inject
    private QuickAccessService quickAccessService;

    @Get("/classify")
    public ClassificationResponse classify(@QueryValue(defaultValue = "") String input) {
        ValidationClass classification = StationNormalizer.classify(input);
        return new ClassificationResponse(input, classification, classification.isResolvable(),
                classification.getMessage(), StationNormalizer.normalize(input), StationNormalizer.suggest(input));
    }

    @Get("/{buildingId}/lookup")
    public HttpResponse<?> lookup(@PathVariable int buildingId,
                                  @QueryValue(defaultValue = "") String input,
                                  @QueryValue(defaultValue = "false") boolean recordUsage) {
        log.info("GET /{}/lookup input='{}' recordUsage={}", buildingId, input, recordUsage);
        return OutcomeResponses.toResponse(lookupService.lookup(buildingId, input, recordUsage));
    }

    @Get("/{buildingId}")
    public HttpResponse<?> listAll(@PathVariable int buildingId) {
        return OutcomeResponses.toResponse(lookupService.listAll(buildingId));
    }

    @Get("/{buildingId}/search")
    public HttpResponse<?> search(@PathVariable int buildingId, @QueryValue(defaultValue = "") String q) {
        return OutcomeResponses.toResponse(lookupService.search(buildingId, q));
    }

    @Get("/{buildingId}/aisle/{aisle}")
    public HttpResponse<?> byAisle(@PathVariable int buildingId, @PathVariable String aisle) {
        return OutcomeResponses.toResponse(lookupService.byAisle(buildingId, aisle));
    }

    @Get("/{buildingId}/most-used")
    public HttpResponse<?> mostUsed(@PathVariable int buildingId, @QueryValue(defaultValue = "20") int limit) {
        return OutcomeResponses.toResponse(lookupService.mostUsed(buildingId, limit));
    }

    @Get("/{buildingId}/quick-access")
    public HttpResponse<?> quickAccess(@PathVariable int buildingId) {
        return OutcomeResponses.toResponse(quickAccessService.quickAccess(buildingId));
    }

    @Get("/{buildingId}/count")
    public HttpResponse<?> count(@PathVariable int buildingId) {
        return OutcomeResponses.toResponse(lookupService.count(buildingId));
    }

    @Get("/{buildingId}/{key}/exists")
    public HttpResponse<?> exists(@PathVariable int buildingId, @PathVariable String key) {
        return OutcomeResponses.toResponse(lookupService.exists(buildingId, key));
    }

    @Put("/{buildingId}/{key}")
    public HttpResponse<?> upsert(@PathVariable int buildingId,
                                  @PathVariable String key,
                                  @Body @Valid StationUpsertRequest request) {
        log.info("PUT /{}/{} checkDigit={}", buildingId, key, request.checkDigit());
        return OutcomeResponses.toResponse(
                lookupService.upsert(buildingId, key, request.checkDigit(), request.description()));
    }

    @Post("/{buildingId}/{key}/usage")
    public HttpResponse<?> recordUsage(@PathVariable int buildingId, @PathVariable String key) {
        return OutcomeResponses.toResponse(lookupService.recordUsage(buildingId, key));
    }

    @Delete("/{buildingId}/{key}")
    public HttpResponse<?> delete(@PathVariable int buildingId, @PathVariable String key) {
        log.info("DELETE /{}/{}", buildingId, key);
        return OutcomeResponses.toResponse(lookupService.delete(buildingId, key));
    }

    @Delete("/{buildingId}")
    public HttpResponse<?> deleteBuilding(@PathVariable int buildingId) {
        log.info("DELETE /{}", buildingId);
        return OutcomeResponses.toResponse(lookupService.deleteAll(buildingId));
    }

    @Delete
    public HttpResponse<?> deleteEverything() {
        log.warn("DELETE /api/stations - wiping every building");
        return OutcomeResponses.toResponse(lookupService.deleteEverything());
    }
}
