package com.prediction.market.settlement_engine.entity;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * The two outcomes of a binary market. Used both for a bet's side and for a
 * resolved market's outcome.
 */
public enum Side {
    YES,
    NO;

    public Side opposite() {
        return this == YES ? NO : YES;
    }

    /**
     * Lenient parse for request bodies and query params ("yes", "No", ...).
     */
    @JsonCreator
    public static Side fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Side side : values()) {
            if (side.name().equalsIgnoreCase(value.trim())) {
                return side;
            }
        }
        throw new IllegalArgumentException("Side must be YES or NO: " + value);
    }
}
