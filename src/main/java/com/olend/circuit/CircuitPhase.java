package com.olend.circuit;

/**
 * Circuit breaker phase.
 *
 * <ul>
 *   <li>CLOSED: operations flow normally, failures and volume are counted</li>
 *   <li>OPEN: operations are rejected until the recovery timeout elapses</li>
 *   <li>HALF_OPEN: trial operations are let through; the next outcome decides</li>
 * </ul>
 */
public enum CircuitPhase {
    CLOSED,
    OPEN,
    HALF_OPEN
}
