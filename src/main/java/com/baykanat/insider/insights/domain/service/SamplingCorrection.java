package com.baykanat.insider.insights.domain.service;

/** Örneklenmiş sayımları tam popülasyona ölçekler: round(value / factor). Factor 1.0 veya null ise değer aynen döner. */
public final class SamplingCorrection {

    private SamplingCorrection() {
    }

    public static long correct(long value, double samplingFactor) {
        if (samplingFactor == 1.0) {
            return value;
        }
        return Math.round(value / samplingFactor);
    }

    public static double correct(double value, double samplingFactor) {
        if (samplingFactor == 1.0) {
            return value;
        }
        return Math.round(value / samplingFactor);
    }
}
