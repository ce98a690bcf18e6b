package com.prediction.market.settlement_engine.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.settlement_engine.cache.MarketStore;
import com.prediction.market.settlement_engine.engine.FeeCalculator;
import com.prediction.market.settlement_engine.engine.PoolManager;
import com.prediction.market.settlement_engine.engine.PricingEngine;
import com.prediction.market.settlement_engine.execution.MarketExecutionRegistry;
import com.prediction.market.settlement_engine.store.LedgerStore;

@Configuration
public class MarketConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    PricingEngine pricingEngine() {
        return new PricingEngine();
    }

    @Bean
    FeeCalculator feeCalculator(SettlementProperties properties) {
        return new FeeCalculator(properties.platformFeeRate(), properties.creatorFeeRate());
    }

    @Bean
    public MarketStore marketStore(LedgerStore ledgerStore) {
        return new MarketStore(ledgerStore);
    }

    @Bean
    public PoolManager poolManager(MarketStore marketStore, LedgerStore ledgerStore, PricingEngine pricingEngine,
            Clock clock) {
        return new PoolManager(marketStore, ledgerStore, pricingEngine, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public MarketExecutionRegistry marketExecutionRegistry(SettlementProperties properties) {
        return new MarketExecutionRegistry(properties.executionTimeout());
    }
}
