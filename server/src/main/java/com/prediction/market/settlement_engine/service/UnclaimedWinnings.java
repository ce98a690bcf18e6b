package com.prediction.market.settlement_engine.service;

import java.math.BigDecimal;
import java.util.List;

public record UnclaimedWinnings(String userId, BigDecimal total, List<PayoutResult> bets) {
}
