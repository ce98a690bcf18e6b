package com.prediction.market.settlement_engine.web.dto;

import java.math.BigDecimal;

public record BalanceResponse(String userId, BigDecimal balance) {
}
