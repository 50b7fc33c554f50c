package com.baykanat.insider.insights.domain.model;

/** Experiment sonucu için karar kodu. */
public enum SignificanceCode {
    SIGNIFICANT,
    NOT_ENOUGH_DATA,
    LOW_WIN_PROBABILITY,
    HIGH_LOSS,
    NO_RESULTS
}
