package com.olend.exception;

import java.util.Map;

/**
 * Thrown for structurally unusable quotes: non-positive price, exponent mismatch,
 * observation time in the future or behind the asset's price history.
 */
public class InvalidPriceException extends BaseException {

    public InvalidPriceException(String asset, String message) {
        super(ErrorCode.INVALID_PRICE, message, Map.of("asset", asset));
    }
}
