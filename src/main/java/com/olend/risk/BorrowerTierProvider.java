package com.olend.risk;

/**
 * Boundary to the identity layer that owns borrower tiers.
 */
public interface BorrowerTierProvider {

    BorrowerTier tierOf(String borrower);
}
