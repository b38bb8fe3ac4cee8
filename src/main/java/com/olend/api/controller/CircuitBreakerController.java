package com.olend.api.controller;

import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.CircuitDecision;
import com.olend.circuit.OperationKey;
import com.olend.time.TimeSource;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only breaker endpoints. A closed circuit is a normal 200 response with
 * {@code allowed = false}, not an error.
 */
@RestController
@RequestMapping("/api/circuit-breakers")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeSource timeSource;

    public CircuitBreakerController(CircuitBreakerRegistry circuitBreakerRegistry, TimeSource timeSource) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeSource = timeSource;
    }

    @GetMapping("/{operation}")
    public CircuitDecision isOperationAllowed(
            @PathVariable String operation, @RequestParam(required = false) String asset) {
        OperationKey key = OperationKey.parse(asset == null || asset.isBlank() ? operation : operation + ":" + asset);
        return circuitBreakerRegistry.check(key, timeSource.nowSeconds());
    }

    @GetMapping
    public Map<String, Object> getAll() {
        long now = timeSource.nowSeconds();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("globalEmergency", circuitBreakerRegistry.isGlobalEmergency());
        result.put("defaultThresholds", circuitBreakerRegistry.getDefaultThresholds());
        result.put("thresholdOverrides", circuitBreakerRegistry.getThresholdOverrides());
        result.put("breakers", circuitBreakerRegistry.snapshots(now));
        return result;
    }
}
