package com.pallet.checkdigit.controller;

import com.pallet.checkdigit.model.ErrorResponse;
import com.pallet.checkdigit.service.BuildingRegistry;
import com.pallet.checkdigit.service.ImportJob;
import com.pallet.checkdigit.service.ImportJobRegistry;
import com.pallet.checkdigit.service.ImportProgressListener;
import com.pallet.checkdigit.service.StationImportService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.*;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;

/**
 * Bulk import of station check digits from CSV text.
 *
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/stations/import?buildingId=&replace=}  - synchronous import, returns the report</li>
 *   <li>{@code POST /api/stations/import/jobs?buildingId=&replace=} - background import, returns 202 with the job</li>
 *   <li>{@code GET  /api/stations/import/jobs/{jobId}}          - poll a background import</li>
 * </ul>
 *
 * {@code buildingId} is the building for rows without a building column and defaults to
 * {@code stations.default-building}.
 */
@Controller("/api/stations/import")
public class StationImportController {

    private static final Logger log = LoggerFactory.getLogger(StationImportController.class);

    @Inject
    private StationImportService importService;

    @Inject
    private ImportJobRegistry jobRegistry;

    @Inject
    private BuildingRegistry buildings;

    @Post
    @Consumes({"text/csv", MediaType.TEXT_PLAIN})
    public HttpResponse<?> importCsv(@Body String csv,
                                     @Nullable @QueryValue Integer buildingId,
                                     @QueryValue(defaultValue = "false") boolean replace) {
        int building = buildingId == null ? buildings.getDefaultBuilding() : buildingId;
        log.info("POST /api/stations/import building={} replace={} chars={}", building, replace, csv.length());
        return OutcomeResponses.toResponse(
                importService.importCsv(new StringReader(csv), building, replace, ImportProgressListener.NONE));
    }

    @Post("/jobs")
    @Consumes({"text/csv", MediaType.TEXT_PLAIN})
    public HttpResponse<?> submitJob(@Body String csv,
                                     @Nullable @QueryValue Integer buildingId,
                                     @QueryValue(defaultValue = "false") boolean replace) {
        int building = buildingId == null ? buildings.getDefaultBuilding() : buildingId;
        if (!buildings.isKnown(building)) {
            return HttpResponse.badRequest(new ErrorResponse(
                    "Unknown building " + building + ", expected one of " + buildings.getBuildings(), false));
        }
        ImportJob job = jobRegistry.submit(csv, building, replace);
        log.info("POST /api/stations/import/jobs jobId={} building={}", job.getId(), building);
        return HttpResponse.accepted().body(job.toStatus());
    }

    @Get("/jobs/{jobId}")
    public HttpResponse<?> jobStatus(@PathVariable String jobId) {
        return jobRegistry.find(jobId)
                .<HttpResponse<?>>map(job -> HttpResponse.ok(job.toStatus()))
                .orElseGet(HttpResponse::notFound);
    }
}
