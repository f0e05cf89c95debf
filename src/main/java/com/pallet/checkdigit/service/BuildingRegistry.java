package com.pallet.checkdigit.service;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Known warehouse buildings and the default one.
 *
 * The building is always passed explicitly to lookups; this registry only says which
 * ids are acceptable.
 */
@Singleton
public class BuildingRegistry {

    private static final Logger log = LoggerFactory.getLogger(BuildingRegistry.class);

    private final String buildingsConfig;
    private final int defaultBuilding;

    // Parsed building ids; populated lazily
    private volatile Set<Integer> buildings;

    public BuildingRegistry(@Value("${stations.buildings:2,3,4}") String buildingsConfig,
                            @Value("${stations.default-building:3}") int defaultBuilding) {
        this.buildingsConfig = buildingsConfig;
        this.defaultBuilding = defaultBuilding;
    }

    public boolean isKnown(int buildingId) {
        return getBuildings().contains(buildingId);
    }

    public int getDefaultBuilding() {
        return defaultBuilding;
    }

    public Set<Integer> getBuildings() {
        Set<Integer> parsed = buildings;
        if (parsed == null) {
            parsed = parse(buildingsConfig);
            buildings = parsed;
        }
        return parsed;
    }

    private Set<Integer> parse(String config) {
        Set<Integer> ids = new TreeSet<>();
        if (config != null) {
            for (String part : config.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    int id = Integer.parseInt(trimmed);
                    if (id > 0) {
                        ids.add(id);
                    } else {
                        log.warn("Ignoring non-positive building id '{}' in stations.buildings", trimmed);
                    }
                } catch (NumberFormatException e) {
                    log.warn("Ignoring unparseable building id '{}' in stations.buildings", trimmed);
                }
            }
        }
        if (ids.isEmpty()) {
            log.warn("stations.buildings '{}' produced no ids, falling back to default building {}",
                    config, defaultBuilding);
            ids.add(defaultBuilding);
        }
        return Collections.unmodifiableSet(ids);
    }
}
