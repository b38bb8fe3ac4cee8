package com.olend.exception;

import java.util.Map;

/**
 * A lookup by asset (or asset class) found nothing configured or priced for it.
 */
public class ResourceNotFoundException extends BaseException {

    private ResourceNotFoundException(String message, String resource, String key) {
        super(ErrorCode.NOT_FOUND, message, Map.of("resource", resource, "asset", key));
    }

    public static ResourceNotFoundException priceFeed(String asset) {
        return new ResourceNotFoundException("No price feed configured for " + asset, "priceFeed", asset);
    }

    public static ResourceNotFoundException validatedPrice(String asset) {
        return new ResourceNotFoundException("No validated price available for " + asset, "validatedPrice", asset);
    }

    public static ResourceNotFoundException collateralAsset(String asset) {
        return new ResourceNotFoundException(asset + " is not an accepted collateral asset", "collateralAsset", asset);
    }

    public static ResourceNotFoundException assetClass(Object assetClass) {
        String key = String.valueOf(assetClass);
        return new ResourceNotFoundException("No LTV cap configured for asset class " + key, "assetClass", key);
    }
}
