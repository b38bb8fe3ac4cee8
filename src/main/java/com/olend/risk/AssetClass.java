package com.olend.risk;

/**
 * Collateral asset class. Each class carries its own base maximum LTV in {@link CollateralPolicy}.
 */
public enum AssetClass {
    STABLECOIN,
    MAJOR,
    ALTCOIN
}
