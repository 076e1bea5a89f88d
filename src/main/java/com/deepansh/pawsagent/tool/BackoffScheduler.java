package com.deepansh.pawsagent.tool;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Source of executors that start work after a delay. Retry backoff waits on these
 * instead of sleeping a pool thread.
 */
@FunctionalInterface
public interface BackoffScheduler {

    Executor after(Duration delay);

    static BackoffScheduler delayed(Executor executor) {
        return delay -> CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
    }
}
