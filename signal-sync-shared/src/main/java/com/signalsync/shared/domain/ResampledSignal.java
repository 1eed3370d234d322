package com.signalsync.shared.domain;

public record ResampledSignal(double[] samples, double samplingRate) {
}
