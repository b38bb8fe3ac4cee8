package com.olend.exception;

import java.util.Map;

/**
 * Typed form of a circuit-open decision. Callers are expected to fall back
 * (reject gracefully, use a secondary feed) rather than treat this as a crash.
 */
public class CircuitOpenException extends BaseException {

    public CircuitOpenException(String operationKey, String reason) {
        super(
                ErrorCode.CIRCUIT_OPEN,
                "Operation " + operationKey + " is blocked: " + reason,
                Map.of("operationKey", operationKey, "reason", reason));
    }
}
