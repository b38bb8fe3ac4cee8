package com.olend.oracle;

import lombok.Value;

/** One accepted price observation in an asset's history. */
@Value
public class PricePoint {

    long price;
    long confidence;
    long timestamp;
}
