package com.olend.risk;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A borrowing position as held by the borrowing layer.
 *
 * <p>The risk core only reads positions; it never mutates or stores them.
 * Collateral maps asset symbol to raw amount; a position may be backed by several assets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BorrowPosition {

    private String positionId;
    private String borrower;

    /** Asset symbol -> collateral amount. */
    private Map<String, Long> collateral;

    private String borrowedAsset;
    private long borrowedAmount;

    private long createdAt;
    private long updatedAt;
}
