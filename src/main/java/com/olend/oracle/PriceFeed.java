package com.olend.oracle;

import java.util.Optional;

/**
 * Upstream price feed boundary. Implementations return the most recent quote they hold;
 * all trust decisions are made by {@link PriceValidator}.
 */
public interface PriceFeed {

    Optional<RawPriceQuote> latest(String feedId);
}
