package com.prediction.market.settlement_engine.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Settlement engine settings bound from {@code settlement.*}.
 * Missing values fall back to the defaults below.
 */
@Validated
@ConfigurationProperties(prefix = "settlement")
public record SettlementProperties(
        @Positive BigDecimal seedLiquidity,
        @DecimalMin("0") @DecimalMax(value = "1", inclusive = false) BigDecimal platformFeeRate,
        @DecimalMin("0") @DecimalMax(value = "1", inclusive = false) BigDecimal creatorFeeRate,
        @Positive BigDecimal maxBetAmount,
        @NotBlank String platformAccountId,
        Duration executionTimeout,
        @Valid Wallet wallet,
        @Valid Recovery recovery,
        @Valid Security security,
        @Valid Throttle throttle) {

    public SettlementProperties {
        if (seedLiquidity == null) {
            seedLiquidity = new BigDecimal("1000");
        }
        if (platformFeeRate == null) {
            platformFeeRate = new BigDecimal("0.02");
        }
        if (creatorFeeRate == null) {
            creatorFeeRate = new BigDecimal("0.10");
        }
        if (maxBetAmount == null) {
            maxBetAmount = new BigDecimal("1000000");
        }
        if (platformAccountId == null) {
            platformAccountId = "platform";
        }
        if (executionTimeout == null) {
            executionTimeout = Duration.ofSeconds(5);
        }
        if (wallet == null) {
            wallet = new Wallet(null, null, null);
        }
        if (recovery == null) {
            recovery = new Recovery(null, null, null, null);
        }
        if (security == null) {
            security = new Security(null, null);
        }
        if (throttle == null) {
            throttle = new Throttle(null);
        }
    }

    /**
     * Bounded retry and per-call timeout around wallet calls.
     */
    public record Wallet(
            @Min(1) Integer maxAttempts,
            Duration retryWait,
            Duration callTimeout) {

        public Wallet {
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (retryWait == null) {
                retryWait = Duration.ofMillis(200);
            }
            if (callTimeout == null) {
                callTimeout = Duration.ofSeconds(2);
            }
        }
    }

    public record Recovery(
            Boolean enabled,
            @Positive Long intervalMillis,
            Duration pendingGrace,
            @Min(1) Integer batchSize) {

        public Recovery {
            if (enabled == null) {
                enabled = true;
            }
            if (intervalMillis == null) {
                intervalMillis = 30_000L;
            }
            if (pendingGrace == null) {
                pendingGrace = Duration.ofSeconds(30);
            }
            if (batchSize == null) {
                batchSize = 100;
            }
        }
    }

    /**
     * HMAC secret for bearer tokens; at least 32 bytes.
     */
    public record Security(
            String jwtSecret,
            Duration tokenTtl) {

        public Security {
            if (tokenTtl == null) {
                tokenTtl = Duration.ofHours(1);
            }
        }
    }

    public record Throttle(
            @Min(1) Integer requestsPerSecond) {

        public Throttle {
            if (requestsPerSecond == null) {
                requestsPerSecond = 10;
            }
        }
    }
}
