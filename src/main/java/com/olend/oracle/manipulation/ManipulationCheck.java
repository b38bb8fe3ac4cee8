package com.olend.oracle.manipulation;

/** The independent checks run by {@link ManipulationDetector}. */
public enum ManipulationCheck {

    /** Single-step relative move above the feed's deviation threshold. */
    SPIKE,

    /** Sum of signed moves over the recent window above the cumulative threshold. */
    CUMULATIVE_DRIFT,

    /** Confidence tightened sharply while the price moved sharply. */
    CONFIDENCE_MISMATCH,

    /** Price pumped then fell back below its pre-rise level within a short window. */
    OSCILLATION
}
