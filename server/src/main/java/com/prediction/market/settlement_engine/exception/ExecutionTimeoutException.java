package com.prediction.market.settlement_engine.exception;

import java.time.Duration;

/**
 * The caller stopped waiting. The queued operation still runs to completion
 * or rolls back on the market's executor.
 */
public class ExecutionTimeoutException extends SettlementException {

    public ExecutionTimeoutException(String marketId, Duration timeout) {
        super(ErrorKind.DEPENDENCY, "EXECUTION_TIMEOUT",
                String.format("Market %s did not finish within %d ms", marketId, timeout.toMillis()));
    }
}
