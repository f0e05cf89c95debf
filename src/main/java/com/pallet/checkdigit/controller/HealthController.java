package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.model.Outcome;
import com.pallet.checkdigit.service.StationLookupService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Liveness probe. Reports {@code {"status":"UP","stations":n}} while the station table is
 * reachable and {@code DOWN} with 503 otherwise.
 */
@Controller("/health")
public class HealthController {

    @Inject
    private StationLookupService lookupService;

    @Get
    public HttpResponse<Map<String, Object>> health() {
        Outcome<Integer> count = lookupService.countAll();
        if (count.isOk()) {
            Map<String, Object> up = Map.of("status", "UP", "stations", count.value());
            return HttpResponse.ok(up);
        }
        Map<String, Object> down = Map.of("status", "DOWN", "message", count.message());
        return HttpResponse.<Map<String, Object>>status(HttpStatus.SERVICE_UNAVAILABLE).body(down);
    }
}
