package com.olend.risk;

/**
 * Borrower standing as reported by the identity layer. Higher tiers earn an LTV bonus.
 */
public enum BorrowerTier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM,
    DIAMOND
}
