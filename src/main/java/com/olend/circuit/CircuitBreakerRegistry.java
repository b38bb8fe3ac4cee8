package com.olend.circuit;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.oracle.manipulation.ManipulationAssessment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Keyed set of circuit breakers, one per {@link OperationKey}, created lazily on first use.
 *
 * <p>Fed by the oracle layer (validation failures, manipulation flags) and by callers of
 * gated operations (success, failure, volume). Every phase change is published as a
 * {@link RiskEventType#CIRCUIT_BREAKER_TRANSITION} event after the breaker lock is released.
 *
 * <p><b>Global emergency:</b> a registry-wide flag, set and cleared only with an
 * {@link AdminCapability}, that makes every breaker behave as OPEN regardless of its own
 * phase. There is no automatic recovery from it.
 *
 * <p><b>Thresholds:</b> resolved per key as exact-key override, then operation-type override,
 * then the global default.
 *
 * <p><b>Thread safety:</b> breakers live in a ConcurrentHashMap and each breaker serializes
 * its own mutations; different keys never contend.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    public static final String DEFAULT_SCOPE = "DEFAULT";

    private final Map<OperationKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Map<String, ThresholdConfig> thresholdOverrides = new ConcurrentHashMap<>();
    private final AtomicReference<ThresholdConfig> defaultThresholds;
    private final Set<OperationType> manipulationSensitiveOperations;
    private final AtomicBoolean globalEmergency = new AtomicBoolean(false);
    private final AdminCapabilityAuthority authority;
    private final ApplicationEventPublisher applicationEventPublisher;

    public CircuitBreakerRegistry(
            ThresholdConfig defaultThresholds,
            Map<String, ThresholdConfig> thresholdOverrides,
            Set<OperationType> manipulationSensitiveOperations,
            AdminCapabilityAuthority authority,
            ApplicationEventPublisher applicationEventPublisher) {
        defaultThresholds.validate();
        thresholdOverrides.forEach((scope, config) -> {
            normalizeScope(scope);
            config.validate();
        });
        this.defaultThresholds = new AtomicReference<>(defaultThresholds);
        thresholdOverrides.forEach((scope, config) -> this.thresholdOverrides.put(normalizeScope(scope), config));
        this.manipulationSensitiveOperations = manipulationSensitiveOperations.isEmpty()
                ? EnumSet.of(OperationType.PRICE_FEED)
                : EnumSet.copyOf(manipulationSensitiveOperations);
        this.manipulationSensitiveOperations.add(OperationType.PRICE_FEED);
        this.authority = authority;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // GATING
    // ========================

    /**
     * Decides whether an operation may proceed. Never throws for an open circuit: a rejection
     * is returned as a normal decision.
     */
    public CircuitDecision check(OperationKey key, long now) {
        String keyName = key.toString();
        if (globalEmergency.get()) {
            return CircuitDecision.globalEmergency(keyName);
        }
        CircuitBreaker breaker = breakerFor(key, now);
        publish(breaker.advance(now, thresholdsFor(key)));
        return switch (breaker.phase()) {
            case CLOSED -> CircuitDecision.allowed(keyName);
            case HALF_OPEN -> CircuitDecision.trial(keyName);
            case OPEN -> CircuitDecision.rejected(
                    keyName, breaker.lastTripReason() != null ? breaker.lastTripReason() : "circuit open");
        };
    }

    /**
     * True when the operation may proceed (breaker closed or half-open probing, no global emergency).
     */
    public boolean isOperationAllowed(OperationKey key, long now) {
        return check(key, now).isAllowed();
    }

    // ========================
    // OUTCOME FEEDBACK
    // ========================

    public void recordSuccess(OperationKey key, long now) {
        publish(breakerFor(key, now).recordSuccess(now, thresholdsFor(key)));
    }

    public void recordFailure(OperationKey key, long now, String reason) {
        publish(breakerFor(key, now).recordFailure(now, thresholdsFor(key), reason));
    }

    public void recordVolume(OperationKey key, long amount, long now) {
        publish(breakerFor(key, now).recordVolume(now, thresholdsFor(key), amount));
    }

    /**
     * Opens every manipulation-sensitive breaker keyed on {@code asset} when the detector
     * reports risk level 2 or higher. Lower levels are ignored.
     */
    public void reportManipulation(String asset, int riskLevel, long now) {
        if (riskLevel < ManipulationAssessment.RISK_HIGH) {
            return;
        }
        String reason = "price manipulation detected for " + asset + " (risk level " + riskLevel + ")";
        log.warn("Tripping {} breakers for {}: {}", manipulationSensitiveOperations, asset, reason);
        List<PhaseTransition> transitions = new ArrayList<>();
        for (OperationType operationType : manipulationSensitiveOperations) {
            OperationKey key = OperationKey.of(operationType, asset);
            transitions.addAll(breakerFor(key, now).trip(now, reason));
        }
        publish(transitions);
    }

    // ========================
    // GLOBAL EMERGENCY
    // ========================

    public boolean isGlobalEmergency() {
        return globalEmergency.get();
    }

    /**
     * Sets or clears the global emergency flag.
     *
     * @return the previous value
     */
    public boolean setGlobalEmergency(AdminCapability capability, boolean active, String reason, long now) {
        authority.verify(capability);
        boolean previous = globalEmergency.getAndSet(active);
        if (previous != active) {
            if (active) {
                log.error("GLOBAL EMERGENCY ACTIVATED by {}: {}", capability.getId(), reason);
            } else {
                log.info("Global emergency cleared by {}: {}", capability.getId(), reason);
            }
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.GLOBAL_EMERGENCY_CHANGED,
                    active ? RiskLevel.CRITICAL : RiskLevel.INFO,
                    "GLOBAL",
                    "Global emergency " + (active ? "activated" : "cleared") + ": " + reason,
                    Map.of("before", previous, "after", active, "by", capability.getId()),
                    now));
        }
        return previous;
    }

    // ========================
    // ADMIN
    // ========================

    /**
     * Replaces the thresholds for a scope: {@code DEFAULT}, an operation type ({@code BORROW}),
     * or an exact key ({@code BORROW:BTC}). Validated in full before being applied.
     *
     * @return the previously effective thresholds for that scope
     */
    public ThresholdConfig updateThresholds(AdminCapability capability, String scope, ThresholdConfig config) {
        authority.verify(capability);
        String normalized = normalizeScope(scope);
        config.validate();
        ThresholdConfig previous;
        if (DEFAULT_SCOPE.equals(normalized)) {
            previous = defaultThresholds.getAndSet(config);
        } else {
            ThresholdConfig replaced = thresholdOverrides.put(normalized, config);
            previous = replaced != null ? replaced : defaultThresholds.get();
        }
        log.info("Circuit breaker thresholds for {} updated: {} -> {}", normalized, previous, config);
        return previous;
    }

    /**
     * Returns a breaker to CLOSED and clears its counters.
     */
    public void forceReset(AdminCapability capability, OperationKey key, long now) {
        authority.verify(capability);
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null) {
            return;
        }
        log.info("Circuit breaker {} force-reset by {}", key, capability.getId());
        publish(breaker.reset(now, "force reset by " + capability.getId()));
    }

    // ========================
    // QUERIES
    // ========================

    public ThresholdConfig thresholdsFor(OperationKey key) {
        ThresholdConfig exact = thresholdOverrides.get(key.toString());
        if (exact != null) {
            return exact;
        }
        ThresholdConfig byType = thresholdOverrides.get(key.getOperationType().name());
        if (byType != null) {
            return byType;
        }
        return defaultThresholds.get();
    }

    public ThresholdConfig getDefaultThresholds() {
        return defaultThresholds.get();
    }

    public Map<String, ThresholdConfig> getThresholdOverrides() {
        return Collections.unmodifiableMap(thresholdOverrides);
    }

    public CircuitBreakerState snapshot(OperationKey key, long now) {
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null) {
            return CircuitBreakerState.builder()
                    .operationKey(key.toString())
                    .phase(CircuitPhase.CLOSED)
                    .build();
        }
        return breaker.snapshot(now, thresholdsFor(key));
    }

    public Map<String, CircuitBreakerState> snapshots(long now) {
        Map<String, CircuitBreakerState> result = new LinkedHashMap<>();
        breakers.entrySet().stream()
                .sorted(Map.Entry.comparingByKey((a, b) -> a.toString().compareTo(b.toString())))
                .forEach(e -> result.put(e.getKey().toString(), e.getValue().snapshot(now, thresholdsFor(e.getKey()))));
        return result;
    }

    /** Number of breakers not currently CLOSED. */
    public int nonClosedCount() {
        return (int) breakers.values().stream()
                .filter(b -> b.phase() != CircuitPhase.CLOSED)
                .count();
    }

    // ========================
    // INTERNALS
    // ========================

    private CircuitBreaker breakerFor(OperationKey key, long now) {
        return breakers.computeIfAbsent(key, k -> new CircuitBreaker(k.toString(), now));
    }

    private static String normalizeScope(String scope) {
        if (scope == null || scope.isBlank() || DEFAULT_SCOPE.equalsIgnoreCase(scope)) {
            return DEFAULT_SCOPE;
        }
        return OperationKey.parse(scope).toString();
    }

    private void publish(List<PhaseTransition> transitions) {
        for (PhaseTransition transition : transitions) {
            boolean opened = transition.to() == CircuitPhase.OPEN;
            if (opened) {
                log.warn(
                        "Circuit breaker {} {} -> {}: {}",
                        transition.operationKey(),
                        transition.from(),
                        transition.to(),
                        transition.reason());
            } else {
                log.info(
                        "Circuit breaker {} {} -> {}: {}",
                        transition.operationKey(),
                        transition.from(),
                        transition.to(),
                        transition.reason());
            }
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_TRANSITION,
                    opened ? RiskLevel.CRITICAL : RiskLevel.INFO,
                    transition.operationKey(),
                    "Circuit breaker " + transition.operationKey() + " " + transition.from() + " -> "
                            + transition.to(),
                    Map.of(
                            "before", transition.from().name(),
                            "after", transition.to().name(),
                            "reason", String.valueOf(transition.reason())),
                    transition.at()));
        }
    }
}
