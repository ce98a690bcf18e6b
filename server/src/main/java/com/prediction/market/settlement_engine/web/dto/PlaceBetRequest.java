package com.prediction.market.settlement_engine.web.dto;

import java.math.BigDecimal;

import com.prediction.market.settlement_engine.entity.Side;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Side and amount are checked by the bet validator so that rejections carry
 * the INVALID_AMOUNT / INVALID_BET codes.
 */
public record PlaceBetRequest(
        @NotBlank String marketId,
        Side side,
        BigDecimal grossAmount,
        @Size(max = 128) String nonce) {
}
