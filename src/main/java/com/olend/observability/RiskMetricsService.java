package com.olend.observability;

import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.event.RiskEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the risk core.
 *
 * <ul>
 *   <li><b>olend.risk.events</b> (counter, tags type/level): every published {@link RiskEvent}</li>
 *   <li><b>olend.risk.global.emergency</b> (gauge 0/1): global emergency flag</li>
 *   <li><b>olend.risk.breakers.not.closed</b> (gauge): breakers in OPEN or HALF_OPEN</li>
 * </ul>
 *
 * <p>Gauges are evaluated by Micrometer on scrape.
 */
@Service
public class RiskMetricsService {

    static final String EVENTS_METRIC = "olend.risk.events";

    private final MeterRegistry meterRegistry;

    public RiskMetricsService(MeterRegistry meterRegistry, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge(
                "olend.risk.global.emergency",
                circuitBreakerRegistry,
                registry -> registry.isGlobalEmergency() ? 1.0 : 0.0);
        meterRegistry.gauge("olend.risk.breakers.not.closed", circuitBreakerRegistry, CircuitBreakerRegistry::nonClosedCount);
    }

    /**
     * Ordered after the core listeners.
     */
    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        eventCounter(event).increment();
    }

    private Counter eventCounter(RiskEvent event) {
        return Counter.builder(EVENTS_METRIC)
                .description("Risk events published by the risk core")
                .tag("type", event.getEventType().name())
                .tag("level", event.getLevel().name())
                .register(meterRegistry);
    }
}
