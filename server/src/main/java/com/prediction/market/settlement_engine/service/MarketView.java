package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.MarketStatus;
import com.prediction.market.settlement_engine.entity.Side;

/**
 * Market with its derived prices. Prices are null once either pool is empty,
 * which cannot happen for a seeded market.
 */
public record MarketView(
        String id,
        String title,
        String categoryId,
        String creatorId,
        BigDecimal yesPool,
        BigDecimal noPool,
        BigDecimal yesPrice,
        BigDecimal noPrice,
        BigDecimal totalVolume,
        MarketStatus status,
        Side outcome,
        long endDate,
        Long resolvedAt,
        String resolutionNote,
        BigDecimal platformFeeRate,
        BigDecimal creatorFeeRate,
        long revision) {
}
