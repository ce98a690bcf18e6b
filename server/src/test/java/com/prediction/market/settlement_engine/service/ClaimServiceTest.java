package com.prediction.market.settlement_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.exception.AlreadyClaimedException;
import com.prediction.market.settlement_engine.exception.BetNotFoundException;
import com.prediction.market.settlement_engine.exception.MarketNotResolvedException;
import com.prediction.market.settlement_engine.exception.NotBetOwnerException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.support.InMemoryWalletService.Fault;
import com.prediction.market.settlement_engine.support.SettlementHarness;

class ClaimServiceTest {

    private final SettlementHarness h = new SettlementHarness();
    private Market market;
    private Bet yesBet;
    private Bet noBet;

    @BeforeEach
    void placeBets() {
        market = h.openMarket();
        h.fund("alice", "500");
        h.fund("bob", "500");
        yesBet = h.betExecutionService.placeBet(market.getId(), "alice", Side.YES, new BigDecimal("100"), null);
        noBet = h.betExecutionService.placeBet(market.getId(), "bob", Side.NO, new BigDecimal("100"), null);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void winnerIsPaidNetStakeOverLockedPriceExactlyOnce() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);

        PayoutResult result = h.claimService.claim(yesBet.getId(), "alice");

        assertThat(result.won()).isTrue();
        assertThat(result.payout()).isEqualByComparingTo("176.00");
        assertThat(result.transferStatus()).isEqualTo(TransferStatus.CONFIRMED);
        assertThat(result.transferKey()).isEqualTo("bet:" + yesBet.getId() + ":payout");
        assertThat(h.balance("alice")).isEqualTo(Money.of("576.00"));

        assertThatThrownBy(() -> h.claimService.claim(yesBet.getId(), "alice"))
                .isInstanceOf(AlreadyClaimedException.class);
        assertThat(h.wallet.fundsMoved(result.transferKey())).isEqualTo(1);
        assertThat(h.balance("alice")).isEqualTo(Money.of("576.00"));
    }

    @Test
    void loserClaimSettlesWithoutTransfer() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);
        int creditsBefore = h.wallet.creditCalls();

        PayoutResult result = h.claimService.claim(noBet.getId(), "bob");

        assertThat(result.won()).isFalse();
        assertThat(result.payout()).isEqualByComparingTo("0");
        assertThat(result.transferStatus()).isEqualTo(TransferStatus.NOT_REQUIRED);
        assertThat(h.wallet.creditCalls()).isEqualTo(creditsBefore);
        assertThatThrownBy(() -> h.claimService.claim(noBet.getId(), "bob"))
                .isInstanceOf(AlreadyClaimedException.class);
    }

    @Test
    void claimRequiresOwnershipAndResolution() {
        assertThatThrownBy(() -> h.claimService.claim(yesBet.getId(), "alice"))
                .isInstanceOf(MarketNotResolvedException.class);

        h.resolutionService.resolve(market.getId(), Side.YES, null);

        assertThatThrownBy(() -> h.claimService.claim(yesBet.getId(), "bob"))
                .isInstanceOf(NotBetOwnerException.class);
        assertThatThrownBy(() -> h.claimService.claim("no-such-bet", "alice"))
                .isInstanceOf(BetNotFoundException.class);
        assertThat(h.ledgerStore.findBet(yesBet.getId()).orElseThrow().isClaimed()).isFalse();
    }

    @Test
    void concurrentClaimsCreditOnce() throws Exception {
        h.resolutionService.resolve(market.getId(), Side.YES, null);
        ExecutorService callers = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PayoutResult>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(callers.submit(() -> {
                start.await();
                return h.claimService.claim(yesBet.getId(), "alice");
            }));
        }
        start.countDown();

        int paid = 0;
        for (Future<PayoutResult> future : futures) {
            try {
                future.get(10, TimeUnit.SECONDS);
                paid++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(AlreadyClaimedException.class);
            }
        }
        callers.shutdown();

        assertThat(paid).isEqualTo(1);
        assertThat(h.wallet.fundsMoved("bet:" + yesBet.getId() + ":payout")).isEqualTo(1);
        assertThat(h.balance("alice")).isEqualTo(Money.of("576.00"));
    }

    @Test
    void unreachableWalletLeavesARetryableTransfer() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);
        h.wallet.failCredits(Fault.THROW, 3);

        assertThatThrownBy(() -> h.claimService.claim(yesBet.getId(), "alice"))
                .isInstanceOfSatisfying(SettlementPendingException.class,
                        e -> assertThat(e.getRetryToken()).isEqualTo("bet:" + yesBet.getId() + ":payout"));

        Bet stored = h.ledgerStore.findBet(yesBet.getId()).orElseThrow();
        assertThat(stored.isClaimed()).isTrue();
        assertThat(stored.getTransferStatus()).isEqualTo(TransferStatus.FAILED);
        assertThat(stored.getPayout()).isEqualByComparingTo("176.00");

        PayoutResult retried = h.claimService.retryTransfer(yesBet.getId(), "alice");

        assertThat(retried.transferStatus()).isEqualTo(TransferStatus.CONFIRMED);
        assertThat(h.balance("alice")).isEqualTo(Money.of("576.00"));
    }

    @Test
    void creditAppliedButUnacknowledgedIsNeverPaidTwice() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);
        h.wallet.failCredits(Fault.APPLY_THEN_THROW, 1);
        h.wallet.failCredits(Fault.THROW, 2);

        assertThatThrownBy(() -> h.claimService.claim(yesBet.getId(), "alice"))
                .isInstanceOf(SettlementPendingException.class);
        h.claimService.retryTransfer(yesBet.getId(), "alice");
        h.claimService.retryTransfer(yesBet.getId(), "alice");

        assertThat(h.wallet.fundsMoved("bet:" + yesBet.getId() + ":payout")).isEqualTo(1);
        assertThat(h.balance("alice")).isEqualTo(Money.of("576.00"));
        assertThat(h.ledgerStore.findBet(yesBet.getId()).orElseThrow().getTransferStatus())
                .isEqualTo(TransferStatus.CONFIRMED);
    }

    @Test
    void acceptedButUnconfirmedCreditIsReportedAsSent() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);
        h.wallet.failCredits(Fault.ACCEPT_PENDING, 1);

        PayoutResult result = h.claimService.claim(yesBet.getId(), "alice");

        assertThat(result.transferStatus()).isEqualTo(TransferStatus.SENT);
        assertThat(h.ledgerStore.findBet(yesBet.getId()).orElseThrow().getTransferStatus())
                .isEqualTo(TransferStatus.SENT);
    }

    @Test
    void retryOfUnclaimedBetPerformsTheClaim() {
        h.resolutionService.resolve(market.getId(), Side.YES, null);

        PayoutResult result = h.claimService.retryTransfer(yesBet.getId(), "alice");

        assertThat(result.transferStatus()).isEqualTo(TransferStatus.CONFIRMED);
        assertThat(h.ledgerStore.findBet(yesBet.getId()).orElseThrow().isClaimed()).isTrue();
    }

    @Test
    void unclaimedWinningsListOnlyWinningUnclaimedBets() {
        h.fund("alice", "100");
        Bet secondYes = h.betExecutionService.placeBet(market.getId(), "alice", Side.YES, new BigDecimal("50"), null);
        h.resolutionService.resolve(market.getId(), Side.YES, null);

        UnclaimedWinnings before = h.claimService.unclaimedWinnings("alice");
        Money expected = h.claimService.computePayout(yesBet)
                .add(h.claimService.computePayout(h.ledgerStore.findBet(secondYes.getId()).orElseThrow()));
        assertThat(before.bets()).hasSize(2);
        assertThat(before.total()).isEqualByComparingTo(expected.toBigDecimal());
        assertThat(h.claimService.unclaimedWinnings("bob").bets()).isEmpty();

        h.claimService.claim(yesBet.getId(), "alice");

        assertThat(h.claimService.unclaimedWinnings("alice").bets())
                .extracting(PayoutResult::betId)
                .containsExactly(secondYes.getId());
    }
}
