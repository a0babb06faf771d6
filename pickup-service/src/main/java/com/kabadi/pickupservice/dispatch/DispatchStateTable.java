package com.kabadi.pickupservice.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offer timers keyed by pickup, each tagged with a generation token.
 * <p>
 * Generations come from one counter for the whole table, so a token is never reused,
 * not even after a pickup's entry was discarded. Starting a new generation cancels
 * the previous timer; a timer that fires anyway carries a stale token and the
 * owner drops it.
 */
@Slf4j
public class DispatchStateTable {

    private final TaskScheduler scheduler;
    private final AtomicLong generations = new AtomicLong();
    private final ConcurrentMap<UUID, DispatchState> states = new ConcurrentHashMap<>();

    public DispatchStateTable(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Starts a new generation for the pickup, invalidating and cancelling whatever
     * timer the previous one had armed.
     */
    public long begin(UUID pickupId) {
        long generation = generations.incrementAndGet();
        DispatchState previous = states.put(pickupId, DispatchState.pending(generation));
        if (previous != null) {
            previous.cancelTimer();
        }
        return generation;
    }

    public boolean isCurrent(UUID pickupId, long generation) {
        DispatchState state = states.get(pickupId);
        return state != null && state.getGeneration() == generation;
    }

    /**
     * Schedules {@code onFire} at {@code fireAt} for the given generation.
     *
     * @return false if the generation was superseded meanwhile; the timer is cancelled then
     */
    public boolean arm(UUID pickupId, long generation, String vendorRef, Instant fireAt, Runnable onFire) {
        if (!isCurrent(pickupId, generation)) {
            return false;
        }
        ScheduledFuture<?> timer = scheduler.schedule(onFire, fireAt);
        DispatchState armed = new DispatchState(generation, vendorRef, timer);
        DispatchState result = states.computeIfPresent(pickupId,
                (id, current) -> current.getGeneration() == generation ? armed : current);
        if (result != armed) {
            armed.cancelTimer();
            log.debug("Generation superseded while arming: pickupId={}, generation={}", pickupId, generation);
            return false;
        }
        return true;
    }

    public void discard(UUID pickupId) {
        DispatchState removed = states.remove(pickupId);
        if (removed != null) {
            removed.cancelTimer();
        }
    }

    // Removes the entry only if it still belongs to this generation
    public void discard(UUID pickupId, long generation) {
        states.computeIfPresent(pickupId, (id, current) -> {
            if (current.getGeneration() != generation) {
                return current;
            }
            current.cancelTimer();
            return null;
        });
    }

    public Optional<DispatchState> get(UUID pickupId) {
        return Optional.ofNullable(states.get(pickupId));
    }

    public int size() {
        return states.size();
    }
}
