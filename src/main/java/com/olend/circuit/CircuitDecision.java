package com.olend.circuit;

import lombok.Getter;

/**
 * Answer to "may this operation proceed?". A rejection is a normal decision, not an error:
 * the caller chooses its fallback.
 */
@Getter
public class CircuitDecision {

    private final String operationKey;
    private final boolean allowed;
    private final boolean trial;
    private final CircuitPhase phase;
    private final boolean globalEmergency;
    private final String reason;

    private CircuitDecision(
            String operationKey,
            boolean allowed,
            boolean trial,
            CircuitPhase phase,
            boolean globalEmergency,
            String reason) {
        this.operationKey = operationKey;
        this.allowed = allowed;
        this.trial = trial;
        this.phase = phase;
        this.globalEmergency = globalEmergency;
        this.reason = reason;
    }

    public static CircuitDecision allowed(String operationKey) {
        return new CircuitDecision(operationKey, true, false, CircuitPhase.CLOSED, false, null);
    }

    /** Half-open: let the operation through as a trial whose outcome closes or re-opens the breaker. */
    public static CircuitDecision trial(String operationKey) {
        return new CircuitDecision(operationKey, true, true, CircuitPhase.HALF_OPEN, false, "trial");
    }

    public static CircuitDecision rejected(String operationKey, String reason) {
        return new CircuitDecision(operationKey, false, false, CircuitPhase.OPEN, false, reason);
    }

    public static CircuitDecision globalEmergency(String operationKey) {
        return new CircuitDecision(operationKey, false, false, CircuitPhase.OPEN, true, "global emergency");
    }

    public boolean isRejected() {
        return !allowed;
    }
}
