package com.prediction.market.settlement_engine.web.dto;

import com.prediction.market.settlement_engine.entity.Side;

import jakarta.validation.constraints.Size;

public record ResolveMarketRequest(Side outcome, @Size(max = 2000) String note) {
}
