package com.olend.oracle;

/**
 * Unvalidated quote as delivered by the upstream feed.
 *
 * @param price      raw price, scaled by 10^exponent
 * @param confidence half-width of the confidence interval, same scale as price
 * @param exponent   decimal exponent of price and confidence
 * @param observedAt logical time the feed observed the price (seconds)
 */
public record RawPriceQuote(long price, long confidence, int exponent, long observedAt) {}
