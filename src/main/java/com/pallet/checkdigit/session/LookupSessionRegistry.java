package com.pallet.checkdigit.session;

import com.pallet.checkdigit.model.Outcome;
import com.pallet.checkdigit.service.BuildingRegistry;
import com.pallet.checkdigit.service.StationLookupService;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Holds the open lookup sessions, one per input field on a device.
 */
@Singleton
public class LookupSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(LookupSessionRegistry.class);

    @Value("${stations.lookup.record-usage-on-hit:true}")
    boolean recordUsageOnHit = true;

    private final StationLookupService lookupService;
    private final BuildingRegistry buildings;
    private final ExecutorService executor;
    private final Map<String, LookupSession> sessions = new ConcurrentHashMap<>();

    @Inject
    public LookupSessionRegistry(StationLookupService lookupService,
                                 BuildingRegistry buildings,
                                 @Named(TaskExecutors.IO) ExecutorService executor) {
        this.lookupService = lookupService;
        this.buildings = buildings;
        this.executor = executor;
    }

    /**
     * Opens a session for the given building, or the default building when null.
     *
     * @return OK with the new session, INVALID for an unknown building
     */
    public Outcome<LookupSession> open(Integer buildingId) {
        int building = buildingId == null ? buildings.getDefaultBuilding() : buildingId;
        if (!buildings.isKnown(building)) {
            return Outcome.invalid("Unknown building " + building + ", expected one of " + buildings.getBuildings());
        }
        LookupSession session = new LookupSession(UUID.randomUUID().toString(), building,
                lookupService, executor, recordUsageOnHit);
        sessions.put(session.getId(), session);
        log.info("Opened lookup session id={} building={} open={}", session.getId(), building, sessions.size());
        return Outcome.ok(session);
    }

    public Optional<LookupSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean close(String sessionId) {
        LookupSession removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        removed.close();
        log.info("Closed lookup session id={}", sessionId);
        return true;
    }

    /**
     * Closes sessions with no activity since {@code cutoff}.
     *
     * @return number of sessions closed
     */
    public int closeIdleSince(Instant cutoff) {
        List<String> idle = sessions.values().stream()
                .filter(s -> s.getLastActivity().isBefore(cutoff))
                .map(LookupSession::getId)
                .toList();
        idle.forEach(this::close);
        return idle.size();
    }

    public int size() {
        return sessions.size();
    }
}
