package com.prediction.market.settlement_engine.execution;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Single thread per market: every task submitted here observes the effects of
 * the tasks before it. The thread exits after sitting idle and is recreated by
 * the next submit.
 */
public class MarketExecutor {
    private final String marketId;
    private final ThreadPoolExecutor executor;

    public MarketExecutor(String marketId, Duration idleTimeout) {
        this.marketId = marketId;
        this.executor = new ThreadPoolExecutor(1, 1, idleTimeout.toMillis(), TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), runnable -> {
                    Thread thread = new Thread(runnable, "market-" + marketId);
                    thread.setDaemon(true);
                    return thread;
                });
        this.executor.allowCoreThreadTimeOut(true);
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    public String getMarketId() {
        return marketId;
    }

    public int liveThreads() {
        return executor.getPoolSize();
    }

    /**
     * Stops accepting work; tasks already queued still run.
     */
    public void shutdown() {
        executor.shutdown();
    }
}
