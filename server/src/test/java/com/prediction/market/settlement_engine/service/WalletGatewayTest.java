package com.prediction.market.settlement_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.exception.WalletUnavailableException;
import com.prediction.market.settlement_engine.wallet.CreditResult;
import com.prediction.market.settlement_engine.wallet.DebitResult;
import com.prediction.market.settlement_engine.wallet.WalletService;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

class WalletGatewayTest {

    private final WalletService walletService = mock(WalletService.class);
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final WalletGateway gateway = new WalletGateway(walletService,
            Retry.of("wallet", RetryConfig.custom()
                    .maxAttempts(3)
                    .waitDuration(Duration.ofMillis(1))
                    .ignoreExceptions(IllegalArgumentException.class)
                    .build()),
            TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(100)).build()),
            executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void retriesWithTheSameKeyUntilTheWalletAnswers() {
        when(walletService.credit("alice", Money.of(5), "bet:b1:payout"))
                .thenThrow(new IllegalStateException("reset"))
                .thenReturn(CreditResult.OK);

        assertThat(gateway.credit("alice", Money.of(5), "bet:b1:payout")).isEqualTo(CreditResult.OK);

        verify(walletService, times(2)).credit("alice", Money.of(5), "bet:b1:payout");
    }

    @Test
    void reportsUnavailableOnceAttemptsRunOut() {
        when(walletService.debit(anyString(), any(), anyString())).thenThrow(new IllegalStateException("down"));

        assertThatThrownBy(() -> gateway.debit("alice", Money.of(5), "bet:b2:debit"))
                .isInstanceOfSatisfying(WalletUnavailableException.class,
                        e -> assertThat(e.getMessage()).contains("bet:b2:debit"));

        verify(walletService, times(3)).debit("alice", Money.of(5), "bet:b2:debit");
    }

    @Test
    void slowWalletCallsTimeOut() {
        when(walletService.debit(anyString(), any(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(1_000);
            return DebitResult.OK;
        });

        assertThatThrownBy(() -> gateway.debit("alice", Money.of(5), "bet:b3:debit"))
                .isInstanceOf(WalletUnavailableException.class);
    }

    @Test
    void rejectedArgumentsAreNotRetried() {
        when(walletService.availableBalance("bad")).thenThrow(new IllegalArgumentException("unknown account"));

        assertThatThrownBy(() -> gateway.availableBalance("bad")).isInstanceOf(IllegalArgumentException.class);

        verify(walletService, times(1)).availableBalance("bad");
    }
}
