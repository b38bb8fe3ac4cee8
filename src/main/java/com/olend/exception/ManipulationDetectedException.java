package com.olend.exception;

import java.util.Map;

public class ManipulationDetectedException extends BaseException {

    public ManipulationDetectedException(String asset, int riskLevel) {
        super(
                ErrorCode.MANIPULATION_DETECTED,
                String.format("Price for %s flagged as manipulated (risk level %d)", asset, riskLevel),
                Map.of("asset", asset, "riskLevel", riskLevel));
    }
}
