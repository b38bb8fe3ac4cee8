package com.olend.circuit;

import com.olend.exception.InvalidConfigException;
import java.util.Locale;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identifies one circuit breaker: an operation type, optionally crossed with an asset.
 * String form is {@code TYPE} or {@code TYPE:ASSET} (e.g. {@code BORROW:BTC}).
 */
@Getter
@EqualsAndHashCode
public final class OperationKey {

    private final OperationType operationType;

    /** Asset symbol, or null for an asset-independent breaker. */
    private final String asset;

    private OperationKey(OperationType operationType, String asset) {
        this.operationType = operationType;
        this.asset = asset;
    }

    public static OperationKey of(OperationType operationType) {
        return new OperationKey(operationType, null);
    }

    public static OperationKey of(OperationType operationType, String asset) {
        return new OperationKey(operationType, asset == null || asset.isBlank() ? null : asset);
    }

    /**
     * Parses {@code TYPE} or {@code TYPE:ASSET}.
     */
    public static OperationKey parse(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidConfigException("operationKey", key, "must not be blank");
        }
        int colon = key.indexOf(':');
        String typePart = colon < 0 ? key : key.substring(0, colon);
        String assetPart = colon < 0 ? null : key.substring(colon + 1);
        try {
            return of(OperationType.valueOf(typePart.toUpperCase(Locale.ROOT)), assetPart);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("operationKey", key, "unknown operation type " + typePart);
        }
    }

    public boolean hasAsset() {
        return asset != null;
    }

    @Override
    public String toString() {
        return asset == null ? operationType.name() : operationType.name() + ":" + asset;
    }
}
