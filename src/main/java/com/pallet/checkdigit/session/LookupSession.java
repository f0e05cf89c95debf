package com.pallet.checkdigit.session;

import com.pallet.checkdigit.model.LookupResult;
import com.pallet.checkdigit.model.Outcome;
import com.pallet.checkdigit.service.StationLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One operator's as-you-type lookup field.
 *
 * <p>Every keystroke replaces the state atomically and returns immediately. When the new
 * input is complete, a lookup is dispatched to the executor under a fresh
 * {@link LookupTicket}; the previous in-flight lookup is cancelled. A result is applied
 * only while the state still waits for its ticket, so an answer for superseded input can
 * never overwrite the answer for newer input, whatever order they complete in.
 *
 * <p>Building switches and clearing the input also cancel the in-flight lookup.
 */
public class LookupSession {

    private static final Logger log = LoggerFactory.getLogger(LookupSession.class);

    private final String id;
    private final StationLookupService lookupService;
    private final Executor executor;
    private final boolean recordUsageOnHit;
    private final Clock clock;

    private final AtomicReference<LookupState> state;
    private final AtomicReference<CompletableFuture<LookupState>> inFlight = new AtomicReference<>();
    private final AtomicLong tickets = new AtomicLong();

    private volatile Instant lastActivity;

    public LookupSession(String id, int buildingId, StationLookupService lookupService,
                         Executor executor, boolean recordUsageOnHit) {
        this(id, buildingId, lookupService, executor, recordUsageOnHit, Clock.systemUTC());
    }

    LookupSession(String id, int buildingId, StationLookupService lookupService,
                  Executor executor, boolean recordUsageOnHit, Clock clock) {
        this.id = id;
        this.lookupService = lookupService;
        this.executor = executor;
        this.recordUsageOnHit = recordUsageOnHit;
        this.clock = clock;
        this.state = new AtomicReference<>(LookupState.initial(buildingId));
        this.lastActivity = clock.instant();
    }

    public String getId() {
        return id;
    }

    public LookupState current() {
        return state.get();
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Handles the full input text after a keystroke.
     *
     * @param raw current content of the input field
     * @return the state right after the keystroke (LOOKING_UP if a lookup was dispatched)
     */
    public LookupState updateInput(String raw) {
        touch();
        cancelInFlight();
        LookupState next = state.updateAndGet(s -> s.withInput(raw));
        if (next.isResolvable()) {
            return startLookup();
        }
        return next;
    }

    /**
     * Switches the building. A complete input is looked up again in the new building.
     */
    public LookupState selectBuilding(int buildingId) {
        touch();
        cancelInFlight();
        LookupState next = state.updateAndGet(s -> s.withBuilding(buildingId));
        log.debug("session={} building switched to {}", id, buildingId);
        if (next.isResolvable()) {
            return startLookup();
        }
        return next;
    }

    public LookupState clear() {
        touch();
        cancelInFlight();
        return state.updateAndGet(LookupState::cleared);
    }

    /**
     * Explicit submit, e.g. a retry after FAILED. Does nothing for incomplete input.
     */
    public LookupState lookupNow() {
        touch();
        if (!state.get().isResolvable()) {
            return state.get();
        }
        cancelInFlight();
        return startLookup();
    }

    /**
     * @return the most recently dispatched lookup, if not cancelled since; completes with the
     *         state after applying (or discarding) its result
     */
    public Optional<CompletableFuture<LookupState>> pendingLookup() {
        return Optional.ofNullable(inFlight.get());
    }

    public void close() {
        cancelInFlight();
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private LookupState startLookup() {
        long ticketId = tickets.incrementAndGet();
        LookupState started = state.updateAndGet(s -> s.isResolvable() ? s.lookupStarted(ticketId) : s);
        if (started.ticket() != ticketId) {
            return started;
        }

        LookupTicket ticket = new LookupTicket(ticketId, started.buildingId(), started.input());
        log.debug("session={} dispatching lookup ticket={} building={} input='{}'",
                id, ticketId, ticket.buildingId(), ticket.input());

        CompletableFuture<LookupState> future = CompletableFuture
                .supplyAsync(() -> lookupService.lookup(ticket.buildingId(), ticket.input()), executor)
                .handle((outcome, error) -> error == null
                        ? apply(ticket, outcome)
                        : apply(ticket, Outcome.failed("Lookup failed, try again", error)));

        CompletableFuture<LookupState> previous = inFlight.getAndSet(future);
        if (previous != null) {
            previous.cancel(true);
        }
        return started;
    }

    private LookupState apply(LookupTicket ticket, Outcome<LookupResult> outcome) {
        boolean[] applied = {false};
        LookupState after = state.updateAndGet(s -> {
            applied[0] = s.accepts(ticket);
            return outcome.isOk() ? s.withResult(ticket, outcome.value()) : s.withFailure(ticket, outcome.message());
        });

        if (!applied[0]) {
            log.debug("session={} discarded stale lookup ticket={} input='{}'", id, ticket.id(), ticket.input());
            return after;
        }

        if (after.phase() == LookupPhase.FOUND && recordUsageOnHit) {
            Outcome<Boolean> usage = lookupService.recordUsage(ticket.buildingId(), after.normalized());
            if (!usage.isOk()) {
                log.warn("session={} could not record usage for key={}: {}", id, after.normalized(), usage.message());
            }
        }
        log.debug("session={} applied ticket={} phase={}", id, ticket.id(), after.phase());
        return after;
    }

    private void cancelInFlight() {
        CompletableFuture<LookupState> previous = inFlight.getAndSet(null);
        if (previous != null && !previous.isDone()) {
            previous.cancel(true);
        }
    }

    private void touch() {
        lastActivity = clock.instant();
    }
}
