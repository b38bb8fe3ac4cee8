package com.olend.exception;

import java.util.Map;

/**
 * Thrown when a configuration update would violate an invariant. The update is
 * rejected as a whole; nothing is applied.
 */
public class InvalidConfigException extends BaseException {

    public InvalidConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }

    public InvalidConfigException(String field, Object value, String constraint) {
        super(
                ErrorCode.INVALID_CONFIG,
                String.format("Invalid %s = %s: %s", field, value, constraint),
                Map.of("field", field, "value", String.valueOf(value), "constraint", constraint));
    }
}
