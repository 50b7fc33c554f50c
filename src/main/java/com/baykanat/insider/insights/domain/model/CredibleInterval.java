package com.baykanat.insider.insights.domain.model;

import lombok.Value;

/** Posterior'un %2.5 ve %97.5 quantile'ları. */
@Value
public class CredibleInterval {
    double lower;
    double upper;
}
