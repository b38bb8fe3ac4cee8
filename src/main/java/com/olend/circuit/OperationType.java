package com.olend.circuit;

/** Operation classes that can be independently halted by a circuit breaker. */
public enum OperationType {
    DEPOSIT,
    WITHDRAW,
    BORROW,
    REPAY,
    LIQUIDATE,
    PRICE_FEED
}
