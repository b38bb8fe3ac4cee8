package com.olend.exception;

import java.util.Map;

public class LtvLimitExceededException extends BaseException {

    public LtvLimitExceededException(String positionId, long ltvBps, long maxAllowedBps) {
        super(
                ErrorCode.LTV_LIMIT_EXCEEDED,
                String.format("Position %s LTV %d bps exceeds max allowed %d bps", positionId, ltvBps, maxAllowedBps),
                Map.of("positionId", String.valueOf(positionId), "ltvBps", ltvBps, "maxAllowedBps", maxAllowedBps));
    }
}
