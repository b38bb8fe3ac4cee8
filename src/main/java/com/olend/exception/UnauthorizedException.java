package com.olend.exception;

import java.util.Map;

/**
 * An admin operation was attempted without a live capability issued by this process.
 */
public class UnauthorizedException extends BaseException {

    public static final String CAPABILITY_REQUIRED = "Admin capability required";

    private UnauthorizedException(String message, Map<String, Object> details) {
        super(ErrorCode.UNAUTHORIZED, message, details);
    }

    public static UnauthorizedException missingCapability() {
        return new UnauthorizedException(CAPABILITY_REQUIRED, Map.of());
    }

    /** The presented token was never issued, or its capability has been revoked. */
    public static UnauthorizedException unknownToken() {
        return new UnauthorizedException("Unknown or revoked admin capability", Map.of());
    }

    public static UnauthorizedException capabilityNotValid(String capabilityId) {
        return new UnauthorizedException(
                "Admin capability " + capabilityId + " is not valid", Map.of("capabilityId", capabilityId));
    }
}
