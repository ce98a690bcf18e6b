package com.prediction.market.settlement_engine.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.config.SettlementProperties;
import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.PendingDebit;
import com.prediction.market.settlement_engine.entity.PendingDebitStatus;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.store.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-drives everything left unfinished by a failed or interrupted request:
 * payout transfers, fee routing and pending debits. Every step reuses the
 * original idempotency key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferRecoveryJob {

    private final SettlementProperties properties;
    private final LedgerStore ledgerStore;
    private final MarketStore marketStore;
    private final ClaimService claimService;
    private final FeeDistributionService feeDistributionService;
    private final DebitCompensationService compensationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${settlement.recovery.interval-millis:30000}")
    public void tick() {
        if (!properties.recovery().enabled()) {
            return;
        }
        try {
            RecoveryReport report = runOnce();
            if (report.attempted() > 0) {
                log.info("recovery run transfers={} fees={} debits={} stillFailing={}",
                        report.transfers(), report.fees(), report.debits(), report.stillFailing());
            }
        } catch (RuntimeException e) {
            log.warn("recovery tick failed: {}", e.toString());
        }
    }

    public RecoveryReport runOnce() {
        long staleBefore = clock.millis() - properties.recovery().pendingGrace().toMillis();
        int limit = properties.recovery().batchSize();
        int failing = 0;

        // FAILED is retried at once; PENDING/SENT only once they have stalled
        List<Bet> transfers = new ArrayList<>(ledgerStore.findStalledTransfers(
                EnumSet.of(TransferStatus.FAILED), Long.MAX_VALUE, limit));
        transfers.addAll(ledgerStore.findStalledTransfers(
                EnumSet.of(TransferStatus.PENDING, TransferStatus.SENT), staleBefore, limit));
        for (Bet bet : transfers) {
            try {
                PayoutResult result = claimService.redrive(bet);
                log.debug("Transfer re-driven betId={} status={}", bet.getId(), result.transferStatus());
            } catch (RuntimeException e) {
                failing++;
                log.warn("Transfer still stalled betId={} status={} error={}",
                        bet.getId(), bet.getTransferStatus(), e.getMessage());
            }
        }

        List<Bet> fees = ledgerStore.findStalledFeeRoutings(staleBefore, limit);
        for (Bet bet : fees) {
            TransferStatus status = feeDistributionService.distribute(bet, marketStore.getMarket(bet.getMarketId()));
            if (status == TransferStatus.PENDING) {
                failing++;
            }
        }

        List<PendingDebit> debits = ledgerStore.findOpenPendingDebits(staleBefore, limit);
        for (PendingDebit pending : debits) {
            try {
                if (compensationService.reverse(pending) == PendingDebitStatus.OPEN) {
                    failing++;
                }
            } catch (RuntimeException e) {
                failing++;
                log.warn("Pending debit still open key={} error={}", pending.getKey(), e.getMessage());
            }
        }

        return new RecoveryReport(transfers.size(), fees.size(), debits.size(), failing);
    }

    public record RecoveryReport(int transfers, int fees, int debits, int stillFailing) {

        public int attempted() {
            return transfers + fees + debits;
        }
    }
}
