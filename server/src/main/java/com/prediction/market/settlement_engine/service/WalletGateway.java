package com.prediction.market.settlement_engine.service;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.exception.SettlementException;
import com.prediction.market.settlement_engine.exception.WalletUnavailableException;
import com.prediction.market.settlement_engine.wallet.CreditResult;
import com.prediction.market.settlement_engine.wallet.DebitResult;
import com.prediction.market.settlement_engine.wallet.WalletService;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * The only path from the engine to the wallet.
 *
 * Each attempt runs under the wallet time limiter; failed or timed-out
 * attempts are retried with the same idempotency key. When attempts run out
 * the caller gets a WalletUnavailableException and must treat the outcome as
 * unknown.
 */
@Slf4j
@Component
public class WalletGateway {

    private final WalletService walletService;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService walletExecutor;

    public WalletGateway(WalletService walletService,
            @Qualifier("walletRetry") Retry retry,
            @Qualifier("walletTimeLimiter") TimeLimiter timeLimiter,
            @Qualifier("walletExecutor") ExecutorService walletExecutor) {
        this.walletService = walletService;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.walletExecutor = walletExecutor;
    }

    public Money availableBalance(String userId) {
        return call("balance", "balance:" + userId, () -> walletService.availableBalance(userId));
    }

    public DebitResult debit(String userId, Money amount, String idempotencyKey) {
        return call("debit", idempotencyKey, () -> walletService.debit(userId, amount, idempotencyKey));
    }

    public CreditResult credit(String userId, Money amount, String idempotencyKey) {
        return call("credit", idempotencyKey, () -> walletService.credit(userId, amount, idempotencyKey));
    }

    private <T> T call(String operation, String key, Supplier<T> walletCall) {
        Callable<T> limited = () -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(walletCall, walletExecutor));
        try {
            return Retry.decorateCallable(retry, limited).call();
        } catch (SettlementException | IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Wallet {} failed after retries key={} error={}", operation, key, e.toString());
            throw new WalletUnavailableException(operation, key, e);
        }
    }
}
