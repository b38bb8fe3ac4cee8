package com.olend.oracle;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PriceFeed} fed by an off-chain relayer that pushes signed quotes per feed id.
 * Keeps only the newest quote per feed; an older quote never replaces a newer one.
 */
@Component
public class PushPriceFeed implements PriceFeed {

    private static final Logger log = LoggerFactory.getLogger(PushPriceFeed.class);

    private final Map<String, RawPriceQuote> latestByFeed = new ConcurrentHashMap<>();

    @Override
    public Optional<RawPriceQuote> latest(String feedId) {
        return Optional.ofNullable(latestByFeed.get(feedId));
    }

    /**
     * Stores a quote for a feed. Returns false (and keeps the current quote) if the pushed
     * quote is older than the one already held.
     */
    public boolean push(String feedId, RawPriceQuote quote) {
        boolean[] accepted = {false};
        latestByFeed.compute(feedId, (id, current) -> {
            if (current != null && quote.observedAt() < current.observedAt()) {
                return current;
            }
            accepted[0] = true;
            return quote;
        });
        if (!accepted[0]) {
            log.debug("Ignored out-of-order quote for feed {} observed at {}", feedId, quote.observedAt());
        }
        return accepted[0];
    }
}
