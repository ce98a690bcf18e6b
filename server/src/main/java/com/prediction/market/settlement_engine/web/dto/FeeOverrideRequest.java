package com.prediction.market.settlement_engine.web.dto;

import java.math.BigDecimal;

/**
 * Omitted rates keep their current value.
 */
public record FeeOverrideRequest(BigDecimal platformFeeRate, BigDecimal creatorFeeRate) {
}
