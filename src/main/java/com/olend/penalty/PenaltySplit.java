package com.olend.penalty;

import lombok.Value;

/**
 * Four-way allocation of a penalty. The shares always sum to {@code total}.
 */
@Value
public class PenaltySplit {

    long total;
    long liquidatorShare;
    long platformShare;
    long insuranceShare;
    long borrowerProtectionShare;
}
