package com.olend.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Structured risk event emitted for every validation failure, manipulation flag,
 * breaker transition, LTV warning and liquidation/penalty outcome.
 *
 * <p>Carries the affected asset (or operation key), a severity level, a human-readable
 * message, condition-specific details (typically {@code before}/{@code after} values)
 * and the logical timestamp at which the condition was observed.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RiskMetricsService: counts events by type and level</li>
 *   <li>Downstream alerting and the borrowing layer (outside this service)</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String subject;
    private final String message;
    private final Map<String, Object> details;
    private final long logicalTimestamp;

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String subject,
            String message,
            long logicalTimestamp) {
        this(source, eventType, level, subject, message, null, logicalTimestamp);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String subject,
            String message,
            Map<String, Object> details,
            long logicalTimestamp) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.subject = subject;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
        this.logicalTimestamp = logicalTimestamp;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    /** Asset symbol or operation key the event is about. */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>CIRCUIT_BREAKER_TRANSITION: {"before": "CLOSED", "after": "OPEN", "reason": "..."}</li>
     *   <li>LTV_WARNING: {"ltvBps": 9600, "warningThresholdBps": 9550}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public long getLogicalTimestamp() {
        return logicalTimestamp;
    }
}
