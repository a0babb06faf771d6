package com.kabadi.pickupservice.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts dispatch work off the caller's thread. Every failure is logged with the
 * pickup and the trigger; nothing escapes silently into the pool.
 */
@Slf4j
public class DispatchLauncher {

    private final Executor executor;

    public DispatchLauncher(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> launch(UUID pickupId, DispatchTrigger trigger, Runnable task) {
        try {
            return CompletableFuture.runAsync(task, executor)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            log.error("Dispatch task failed: pickupId={}, trigger={}", pickupId, trigger, unwrap(ex));
                        }
                    });
        } catch (RejectedExecutionException e) {
            // Recovered by the reconciliation sweep once the pickup has sat idle for an offer window
            log.error("Dispatch executor saturated, task dropped: pickupId={}, trigger={}", pickupId, trigger, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
