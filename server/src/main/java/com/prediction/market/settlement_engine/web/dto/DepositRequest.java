package com.prediction.market.settlement_engine.web.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * reference is the idempotency key: the same reference credits once.
 */
public record DepositRequest(@NotNull BigDecimal amount, @NotBlank String reference) {
}
