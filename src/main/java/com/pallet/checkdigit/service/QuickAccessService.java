package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.Outcome;
import com.pallet.checkdigit.model.QuickAccessView;
import com.pallet.checkdigit.model.StationRecord;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the quick-access lists shown next to the lookup field.
 *
 * Both lists are derived from usage counts in the store; nothing is persisted here.
 */
@Singleton
public class QuickAccessService {

    private static final Logger log = LoggerFactory.getLogger(QuickAccessService.class);

    @Value("${stations.quick-access.recent-limit:10}")
    int recentLimit = 10;

    @Value("${stations.quick-access.frequent-limit:12}")
    int frequentLimit = 12;

    @Value("${stations.quick-access.frequent-min-usage:3}")
    int frequentMinUsage = 3;

    private final StationLookupService lookupService;

    @Inject
    public QuickAccessService(StationLookupService lookupService) {
        this.lookupService = lookupService;
    }

    /**
     * @param buildingId building to rank
     * @return recent (used at least once) and frequent (used at least
     *         {@code frequent-min-usage} times) stations, most used first
     */
    public Outcome<QuickAccessView> quickAccess(int buildingId) {
        Outcome<List<StationRecord>> recent = lookupService.mostUsed(buildingId, 1, recentLimit);
        if (!recent.isOk()) {
            return recent.map(ignored -> null);
        }
        Outcome<List<StationRecord>> frequent = lookupService.mostUsed(buildingId, frequentMinUsage, frequentLimit);
        if (!frequent.isOk()) {
            return frequent.map(ignored -> null);
        }
        log.debug("quickAccess building={} recent={} frequent={}",
                buildingId, recent.value().size(), frequent.value().size());
        return Outcome.ok(new QuickAccessView(buildingId, recent.value(), frequent.value()));
    }
}
