package com.signalsync.shared.domain;

/**
 * Mean and population SD of accepted pulse transit times; both {@code null} when no beat was
 * accepted.
 */
public record PttStats(Double meanS, Double sdS, int acceptedBeats) {

    public static PttStats absent() {
        return new PttStats(null, null, 0);
    }
}
