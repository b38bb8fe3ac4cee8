package com.olend.oracle;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.exception.InvalidConfigException;
import com.olend.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asset symbol -> {@link PriceFeedConfig} table. O(1) lookup by asset.
 *
 * <p>Seeded from configuration at start-up; afterwards changed only through
 * {@link #upsert(AdminCapability, PriceFeedConfig)}.
 */
public class PriceFeedRegistry {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedRegistry.class);

    private final Map<String, PriceFeedConfig> feedsByAsset = new ConcurrentHashMap<>();
    private final AdminCapabilityAuthority authority;

    public PriceFeedRegistry(List<PriceFeedConfig> initialFeeds, AdminCapabilityAuthority authority) {
        this.authority = authority;
        for (PriceFeedConfig feed : initialFeeds) {
            feed.validate();
            if (feedsByAsset.putIfAbsent(feed.getAsset(), feed) != null) {
                throw new InvalidConfigException("asset", feed.getAsset(), "duplicate feed configuration");
            }
        }
        log.info("Price feed registry initialised with {} feeds: {}", feedsByAsset.size(), feedsByAsset.keySet());
    }

    public Optional<PriceFeedConfig> find(String asset) {
        return Optional.ofNullable(feedsByAsset.get(asset));
    }

    /**
     * @throws ResourceNotFoundException if no feed is configured for the asset
     */
    public PriceFeedConfig require(String asset) {
        PriceFeedConfig feed = feedsByAsset.get(asset);
        if (feed == null) {
            throw ResourceNotFoundException.priceFeed(asset);
        }
        return feed;
    }

    public Collection<PriceFeedConfig> all() {
        return Collections.unmodifiableCollection(feedsByAsset.values());
    }

    /**
     * Adds or replaces the feed config for {@code config.asset}. Validated in full before being applied.
     *
     * @return the previous config, or null if the asset was new
     */
    public PriceFeedConfig upsert(AdminCapability capability, PriceFeedConfig config) {
        authority.verify(capability);
        config.validate();
        PriceFeedConfig previous = feedsByAsset.put(config.getAsset(), config);
        log.info("Price feed for {} updated: {} -> {}", config.getAsset(), previous, config);
        return previous;
    }
}
