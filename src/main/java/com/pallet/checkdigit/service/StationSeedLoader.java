package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.ImportReport;
import com.pallet.checkdigit.model.Outcome;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.core.io.ResourceResolver;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Loads the bundled station list into an empty database at startup.
 *
 * Runs only when {@code stations.seed.enabled} is true and the table holds no stations
 * at all, so operator edits are never overwritten.
 */
@Singleton
public class StationSeedLoader {

    private static final Logger log = LoggerFactory.getLogger(StationSeedLoader.class);

    @Value("${stations.seed.enabled:false}")
    boolean enabled;

    @Value("${stations.seed.resource:station_data.csv}")
    String resource = "station_data.csv";

    @Inject
    private StationLookupService lookupService;

    @Inject
    private StationImportService importService;

    @Inject
    private BuildingRegistry buildings;

    @Inject
    private ResourceResolver resourceResolver;

    @EventListener
    public void onStartup(StartupEvent event) {
        if (!enabled) {
            log.debug("Station seed disabled");
            return;
        }
        seedIfEmpty();
    }

    /**
     * @return the import report when seeding ran, empty when skipped or failed
     */
    Optional<ImportReport> seedIfEmpty() {
        Outcome<Integer> count = lookupService.countAll();
        if (!count.isOk()) {
            log.error("Station seed skipped, could not count stations: {}", count.message());
            return Optional.empty();
        }
        if (count.value() > 0) {
            log.info("Station seed skipped, {} stations already present", count.value());
            return Optional.empty();
        }

        Optional<InputStream> stream = resourceResolver.getResourceAsStream("classpath:" + resource);
        if (stream.isEmpty()) {
            log.warn("Station seed resource {} not found", resource);
            return Optional.empty();
        }

        try (InputStream in = stream.get();
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Outcome<ImportReport> outcome = importService.importCsv(
                    reader, buildings.getDefaultBuilding(), false, ImportProgressListener.NONE);
            if (!outcome.isOk()) {
                log.error("Station seed from {} failed: {}", resource, outcome.message());
                return Optional.empty();
            }
            log.info("Seeded {} stations from {} ({} skipped)",
                    outcome.value().inserted(), resource, outcome.value().skipped());
            return Optional.of(outcome.value());
        } catch (IOException e) {
            log.error("Could not read station seed resource {}", resource, e);
            return Optional.empty();
        }
    }
}
