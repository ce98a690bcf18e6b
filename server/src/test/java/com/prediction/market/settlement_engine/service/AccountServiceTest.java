package com.prediction.market.settlement_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.entity.Money;
import com.prediction.market.settlement_engine.exception.InvalidAmountException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.support.InMemoryWalletService.Fault;
import com.prediction.market.settlement_engine.support.SettlementHarness;

class AccountServiceTest {

    private final SettlementHarness h = new SettlementHarness();
    private final AccountService accountService = new AccountService(h.walletGateway);

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void depositIsAppliedOncePerReference() {
        accountService.deposit("alice", new BigDecimal("25.50"), "wire-1");
        accountService.deposit("alice", new BigDecimal("25.50"), "wire-1");

        assertThat(accountService.balance("alice")).isEqualTo(Money.of("25.50"));
        assertThat(h.wallet.fundsMoved("deposit:wire-1")).isEqualTo(1);
    }

    @Test
    void rejectsInvalidDeposits() {
        assertThatThrownBy(() -> accountService.deposit("alice", new BigDecimal("-1"), "r"))
                .isInstanceOf(InvalidAmountException.class);
        assertThatThrownBy(() -> accountService.deposit("alice", new BigDecimal("0.001"), "r"))
                .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void rejectedDepositIsPendingWithItsKey() {
        h.wallet.failCredits(Fault.REJECT, 1);

        assertThatThrownBy(() -> accountService.deposit("alice", BigDecimal.TEN, "wire-2"))
                .isInstanceOfSatisfying(SettlementPendingException.class,
                        e -> assertThat(e.getRetryToken()).isEqualTo("deposit:wire-2"));
    }
}
