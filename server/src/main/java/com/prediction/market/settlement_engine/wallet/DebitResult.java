package com.prediction.market.settlement_engine.wallet;

public enum DebitResult {
    OK,
    INSUFFICIENT
}
