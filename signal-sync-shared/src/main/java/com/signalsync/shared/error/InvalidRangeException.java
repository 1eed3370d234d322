package com.signalsync.shared.error;

import lombok.Getter;

@Getter
public class InvalidRangeException extends SyncAnalysisException {
    private final double start;
    private final double end;

    public InvalidRangeException(double start, double end) {
        super(String.format("ROI end (%s s) must be greater than start (%s s)", end, start));
        this.start = start;
        this.end = end;
    }
}
