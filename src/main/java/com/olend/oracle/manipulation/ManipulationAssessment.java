package com.olend.oracle.manipulation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;

/**
 * Outcome of running every manipulation check against a new price point.
 * The risk level is the highest severity any check produced.
 */
@Getter
public class ManipulationAssessment {

    public static final int RISK_NONE = 0;
    public static final int RISK_LOW = 1;
    public static final int RISK_HIGH = 2;
    public static final int RISK_CRITICAL = 3;

    private final int riskLevel;
    private final Set<ManipulationCheck> triggeredChecks;

    private ManipulationAssessment(int riskLevel, Set<ManipulationCheck> triggeredChecks) {
        this.riskLevel = riskLevel;
        this.triggeredChecks = triggeredChecks;
    }

    public static ManipulationAssessment clean() {
        return new ManipulationAssessment(RISK_NONE, Collections.emptySet());
    }

    public static ManipulationAssessment of(int riskLevel, Set<ManipulationCheck> triggeredChecks) {
        Set<ManipulationCheck> checks = triggeredChecks.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(triggeredChecks));
        return new ManipulationAssessment(riskLevel, checks);
    }

    public boolean isManipulation() {
        return riskLevel >= RISK_HIGH;
    }
}
