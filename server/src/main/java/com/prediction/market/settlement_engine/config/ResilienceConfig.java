package com.prediction.market.settlement_engine.config;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.settlement_engine.exception.SettlementException;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;

/**
 * Retries and timeouts for wallet calls, and the per-identity request throttle.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    /**
     * Retry for wallet calls. Every attempt reuses the caller's idempotency key,
     * so retrying an applied call is harmless. Our own rejections are final.
     */
    @Bean("walletRetry")
    public Retry walletRetry(RetryRegistry registry, SettlementProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.wallet().maxAttempts())
                .waitDuration(properties.wallet().retryWait())
                .retryExceptions(Exception.class)
                .ignoreExceptions(SettlementException.class, IllegalArgumentException.class)
                .build();

        return registry.retry("wallet", config);
    }

    /**
     * Per-call timeout. The running call is cancelled; its key makes a late
     * completion and the retry converge on one application.
     */
    @Bean("walletTimeLimiter")
    public TimeLimiter walletTimeLimiter(TimeLimiterRegistry registry, SettlementProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.wallet().callTimeout())
                .cancelRunningFuture(true)
                .build();

        return registry.timeLimiter("wallet", config);
    }

    @Bean(name = "walletExecutor", destroyMethod = "shutdown")
    public ExecutorService walletExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "wallet-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RateLimiterRegistry requestRateLimiterRegistry(SettlementProperties properties) {
        return RateLimiterRegistry.of(RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(properties.throttle().requestsPerSecond())
                .timeoutDuration(Duration.ZERO)
                .build());
    }
}
