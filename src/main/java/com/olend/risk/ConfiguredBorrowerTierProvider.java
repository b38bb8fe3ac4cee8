package com.olend.risk;

import java.util.Map;

/**
 * Static borrower -> tier table loaded from configuration. Unknown borrowers get the default tier.
 */
public class ConfiguredBorrowerTierProvider implements BorrowerTierProvider {

    private final Map<String, BorrowerTier> tiers;
    private final BorrowerTier defaultTier;

    public ConfiguredBorrowerTierProvider(Map<String, BorrowerTier> tiers, BorrowerTier defaultTier) {
        this.tiers = Map.copyOf(tiers);
        this.defaultTier = defaultTier;
    }

    @Override
    public BorrowerTier tierOf(String borrower) {
        if (borrower == null) {
            return defaultTier;
        }
        return tiers.getOrDefault(borrower, defaultTier);
    }
}
