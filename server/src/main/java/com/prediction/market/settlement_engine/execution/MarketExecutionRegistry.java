package com.prediction.market.settlement_engine.execution;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.prediction.market.settlement_engine.exception.ExecutionTimeoutException;

import lombok.extern.slf4j.Slf4j;

/**
 * Routes market-scoped work to that market's executor and waits for the result.
 */
@Slf4j
public class MarketExecutionRegistry {
    private final ConcurrentHashMap<String, MarketExecutor> executors = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final Duration idleTimeout;

    public MarketExecutionRegistry(Duration timeout) {
        this(timeout, Duration.ofMinutes(1));
    }

    public MarketExecutionRegistry(Duration timeout, Duration idleTimeout) {
        this.timeout = timeout;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Runs the task on the market's thread. Exceptions thrown by the task are
     * rethrown as-is. If the wait times out, the task keeps running.
     */
    public <T> T execute(String marketId, Callable<T> task) {
        Future<T> future = submit(marketId, task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Market task timed out marketId={} timeoutMs={}", marketId, timeout.toMillis());
            throw new ExecutionTimeoutException(marketId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting on market " + marketId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Market task failed marketId=" + marketId, cause);
        }
    }

    private <T> Future<T> submit(String marketId, Callable<T> task) {
        while (true) {
            MarketExecutor executor = executors.computeIfAbsent(marketId, id -> new MarketExecutor(id, idleTimeout));
            try {
                return executor.submit(task);
            } catch (RejectedExecutionException e) {
                // released between lookup and submit
                executors.remove(marketId, executor);
            }
        }
    }

    /**
     * Drops the market's executor once no further serialized work is expected
     * for it. Queued tasks still run; a later submit gets a fresh executor.
     */
    public void release(String marketId) {
        MarketExecutor executor = executors.remove(marketId);
        if (executor != null) {
            executor.shutdown();
            log.debug("Released market executor marketId={}", marketId);
        }
    }

    public int activeMarkets() {
        return executors.size();
    }

    public int liveThreads() {
        return executors.values().stream().mapToInt(MarketExecutor::liveThreads).sum();
    }

    public void shutdown() {
        executors.values().forEach(MarketExecutor::shutdown);
        executors.clear();
    }
}
