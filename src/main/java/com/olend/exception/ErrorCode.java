package com.olend.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_CONFIG("INVALID_CONFIG", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    STALE_PRICE("STALE_PRICE", 422),
    LOW_CONFIDENCE("LOW_CONFIDENCE", 422),
    INVALID_PRICE("INVALID_PRICE", 422),
    MANIPULATION_DETECTED("MANIPULATION_DETECTED", 422),
    LTV_LIMIT_EXCEEDED("LTV_LIMIT_EXCEEDED", 422),
    ARITHMETIC_OVERFLOW("ARITHMETIC_OVERFLOW", 422),
    ARITHMETIC_UNDERFLOW("ARITHMETIC_UNDERFLOW", 422),
    DIVISION_BY_ZERO("DIVISION_BY_ZERO", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    CIRCUIT_OPEN("CIRCUIT_OPEN", 503);

    private final String code;
    private final int httpStatus;
}
