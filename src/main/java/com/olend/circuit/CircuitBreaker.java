package com.olend.circuit;

import com.olend.math.SafeMath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * State machine for a single operation key.
 *
 * <p>Transitions:
 * <ul>
 *   <li>CLOSED -> OPEN: failures inside the window exceed the threshold, in-window volume
 *       exceeds the volume threshold, or a manipulation trip</li>
 *   <li>OPEN -> HALF_OPEN: lazily, on the first call at or after {@code phaseChangeTime + recoveryTimeout}</li>
 *   <li>HALF_OPEN -> CLOSED: next recorded success</li>
 *   <li>HALF_OPEN -> OPEN: next recorded failure (restarts the recovery timeout)</li>
 * </ul>
 *
 * <p>Every state method is synchronized: the breaker is its own per-key critical section.
 * Each method decides the complete next state before assigning any field, so an exception
 * leaves the previous state intact.
 */
class CircuitBreaker {

    private final String operationKey;

    private CircuitPhase phase = CircuitPhase.CLOSED;
    private final Deque<Long> failureTimes = new ArrayDeque<>();
    private final Deque<long[]> volumeEntries = new ArrayDeque<>();
    private long windowVolume;
    private long lastFailureTime;
    private long lastSuccessTime;
    private long phaseChangeTime;
    private String lastTripReason;

    CircuitBreaker(String operationKey, long createdAt) {
        this.operationKey = operationKey;
        this.phaseChangeTime = createdAt;
    }

    /**
     * Applies the time-driven OPEN -> HALF_OPEN transition if the recovery timeout has elapsed.
     */
    synchronized List<PhaseTransition> advance(long now, ThresholdConfig config) {
        List<PhaseTransition> transitions = new ArrayList<>(2);
        applyRecovery(now, config, transitions);
        return transitions;
    }

    synchronized List<PhaseTransition> recordSuccess(long now, ThresholdConfig config) {
        List<PhaseTransition> transitions = new ArrayList<>(2);
        applyRecovery(now, config, transitions);
        lastSuccessTime = now;
        if (phase == CircuitPhase.HALF_OPEN) {
            clearWindows();
            transitions.add(moveTo(CircuitPhase.CLOSED, now, "trial succeeded"));
        }
        return transitions;
    }

    synchronized List<PhaseTransition> recordFailure(long now, ThresholdConfig config, String reason) {
        List<PhaseTransition> transitions = new ArrayList<>(2);
        applyRecovery(now, config, transitions);
        lastFailureTime = now;
        if (phase == CircuitPhase.HALF_OPEN) {
            lastTripReason = "trial failed: " + reason;
            transitions.add(moveTo(CircuitPhase.OPEN, now, lastTripReason));
        } else if (phase == CircuitPhase.CLOSED) {
            pruneFailures(now, config);
            failureTimes.addLast(now);
            if (failureTimes.size() > config.getFailureThreshold()) {
                lastTripReason = String.format(
                        "%d failures within %ds (threshold %d), last: %s",
                        failureTimes.size(),
                        config.getTimeWindowSeconds(),
                        config.getFailureThreshold(),
                        reason);
                transitions.add(moveTo(CircuitPhase.OPEN, now, lastTripReason));
            }
        }
        return transitions;
    }

    synchronized List<PhaseTransition> recordVolume(long now, ThresholdConfig config, long amount) {
        List<PhaseTransition> transitions = new ArrayList<>(2);
        applyRecovery(now, config, transitions);
        if (phase != CircuitPhase.CLOSED || !config.isVolumeTripEnabled()) {
            return transitions;
        }
        pruneVolume(now, config);
        long newVolume = SafeMath.add(windowVolume, amount);
        volumeEntries.addLast(new long[] {now, amount});
        windowVolume = newVolume;
        if (windowVolume > config.getVolumeThreshold()) {
            lastTripReason = String.format(
                    "volume %d within %ds exceeds threshold %d",
                    windowVolume, config.getTimeWindowSeconds(), config.getVolumeThreshold());
            transitions.add(moveTo(CircuitPhase.OPEN, now, lastTripReason));
        }
        return transitions;
    }

    /**
     * Forces the breaker open. An already-open breaker restarts its recovery timeout.
     */
    synchronized List<PhaseTransition> trip(long now, String reason) {
        lastTripReason = reason;
        if (phase == CircuitPhase.OPEN) {
            phaseChangeTime = now;
            return List.of();
        }
        return List.of(moveTo(CircuitPhase.OPEN, now, reason));
    }

    synchronized List<PhaseTransition> reset(long now, String reason) {
        clearWindows();
        lastTripReason = null;
        if (phase == CircuitPhase.CLOSED) {
            return List.of();
        }
        return List.of(moveTo(CircuitPhase.CLOSED, now, reason));
    }

    synchronized CircuitPhase phase() {
        return phase;
    }

    synchronized String lastTripReason() {
        return lastTripReason;
    }

    synchronized CircuitBreakerState snapshot(long now, ThresholdConfig config) {
        long windowStart = now - config.getTimeWindowSeconds();
        int failures = (int) failureTimes.stream().filter(t -> t > windowStart).count();
        long volume = 0;
        for (long[] entry : volumeEntries) {
            if (entry[0] > windowStart) {
                volume = SafeMath.add(volume, entry[1]);
            }
        }
        return CircuitBreakerState.builder()
                .operationKey(operationKey)
                .phase(phase)
                .failureCount(failures)
                .windowVolume(volume)
                .lastFailureTime(lastFailureTime)
                .lastSuccessTime(lastSuccessTime)
                .phaseChangeTime(phaseChangeTime)
                .lastTripReason(lastTripReason)
                .build();
    }

    // ========================
    // INTERNALS
    // ========================

    private void applyRecovery(long now, ThresholdConfig config, List<PhaseTransition> transitions) {
        if (phase == CircuitPhase.OPEN && now - phaseChangeTime >= config.getRecoveryTimeoutSeconds()) {
            transitions.add(moveTo(CircuitPhase.HALF_OPEN, now, "recovery timeout elapsed"));
        }
    }

    private PhaseTransition moveTo(CircuitPhase target, long now, String reason) {
        CircuitPhase from = phase;
        phase = target;
        phaseChangeTime = now;
        return new PhaseTransition(operationKey, from, target, reason, now);
    }

    private void pruneFailures(long now, ThresholdConfig config) {
        long windowStart = now - config.getTimeWindowSeconds();
        while (!failureTimes.isEmpty() && failureTimes.peekFirst() <= windowStart) {
            failureTimes.pollFirst();
        }
    }

    private void pruneVolume(long now, ThresholdConfig config) {
        long windowStart = now - config.getTimeWindowSeconds();
        while (!volumeEntries.isEmpty() && volumeEntries.peekFirst()[0] <= windowStart) {
            windowVolume -= volumeEntries.pollFirst()[1];
        }
    }

    private void clearWindows() {
        failureTimes.clear();
        volumeEntries.clear();
        windowVolume = 0;
    }
}
