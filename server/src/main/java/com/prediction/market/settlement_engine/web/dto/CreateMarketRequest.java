package com.prediction.market.settlement_engine.web.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateMarketRequest(
        @NotBlank String title,
        String categoryId,
        @NotBlank String creatorId,
        @NotNull Long endDate,
        BigDecimal seedLiquidity) {
}
