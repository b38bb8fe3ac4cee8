package com.olend.api.controller;

import com.olend.api.dto.request.QuoteSubmitRequest;
import com.olend.exception.ResourceNotFoundException;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PriceFeedRegistry;
import com.olend.oracle.PriceOracleService;
import com.olend.oracle.PricePoint;
import com.olend.oracle.PriceValidator;
import com.olend.oracle.PushPriceFeed;
import com.olend.oracle.RawPriceQuote;
import com.olend.oracle.ValidatedPriceInfo;
import com.olend.time.TimeSource;
import jakarta.validation.Valid;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for validated prices and quote ingestion.
 *
 * <ul>
 *   <li>GET /api/oracle/prices/{asset} -- validate the latest quote now</li>
 *   <li>GET /api/oracle/prices/{asset}/cached -- last validated info, no re-validation</li>
 *   <li>GET /api/oracle/prices/{asset}/history -- accepted price history, oldest first</li>
 *   <li>GET /api/oracle/feeds -- configured feeds</li>
 *   <li>POST /api/oracle/quotes/{asset} -- relayer pushes a raw quote</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/oracle")
public class OracleController {

    private static final Logger log = LoggerFactory.getLogger(OracleController.class);

    private final PriceOracleService priceOracleService;
    private final PriceFeedRegistry priceFeedRegistry;
    private final PriceValidator priceValidator;
    private final PushPriceFeed pushPriceFeed;
    private final TimeSource timeSource;

    public OracleController(
            PriceOracleService priceOracleService,
            PriceFeedRegistry priceFeedRegistry,
            PriceValidator priceValidator,
            PushPriceFeed pushPriceFeed,
            TimeSource timeSource) {
        this.priceOracleService = priceOracleService;
        this.priceFeedRegistry = priceFeedRegistry;
        this.priceValidator = priceValidator;
        this.pushPriceFeed = pushPriceFeed;
        this.timeSource = timeSource;
    }

    @GetMapping("/prices/{asset}")
    public ValidatedPriceInfo getValidatedPrice(@PathVariable String asset) {
        return priceOracleService.getValidatedPrice(asset);
    }

    @GetMapping("/prices/{asset}/cached")
    public ValidatedPriceInfo getCachedPrice(@PathVariable String asset) {
        return priceOracleService
                .cachedPrice(asset)
                .orElseThrow(() -> ResourceNotFoundException.validatedPrice(asset));
    }

    @GetMapping("/prices/{asset}/history")
    public List<PricePoint> getHistory(@PathVariable String asset) {
        priceFeedRegistry.require(asset);
        return priceValidator.history(asset);
    }

    @GetMapping("/feeds")
    public Collection<PriceFeedConfig> getFeeds() {
        return priceFeedRegistry.all();
    }

    /**
     * Stores a raw quote for later validation. A quote older than the stored one is ignored.
     */
    @PostMapping("/quotes/{asset}")
    public Map<String, Object> submitQuote(@PathVariable String asset, @RequestBody @Valid QuoteSubmitRequest request) {
        PriceFeedConfig feed = priceFeedRegistry.require(asset);
        long observedAt = request.getObservedAt() != null ? request.getObservedAt() : timeSource.nowSeconds();
        RawPriceQuote quote =
                new RawPriceQuote(request.getPrice(), request.getConfidence(), request.getExponent(), observedAt);

        boolean accepted = pushPriceFeed.push(feed.getFeedId(), quote);
        log.debug("Quote for {} ({}) {}: {}", asset, feed.getFeedId(), accepted ? "stored" : "ignored", quote);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("asset", asset);
        result.put("feedId", feed.getFeedId());
        result.put("observedAt", observedAt);
        result.put("accepted", accepted);
        return result;
    }
}
