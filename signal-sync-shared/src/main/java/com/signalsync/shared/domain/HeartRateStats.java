package com.signalsync.shared.domain;

/**
 * Heart rate and RR-interval statistics of one peak train. Fields are {@code null} when
 * fewer than two peaks were available.
 */
public record HeartRateStats(Double hrBpm, Double rrMeanS, Double rrSdS) {

    public static HeartRateStats absent() {
        return new HeartRateStats(null, null, null);
    }

    public boolean isPresent() {
        return rrMeanS != null;
    }
}
