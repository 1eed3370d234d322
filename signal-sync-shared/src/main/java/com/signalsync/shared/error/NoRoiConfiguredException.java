package com.signalsync.shared.error;

public class NoRoiConfiguredException extends SyncAnalysisException {

    public NoRoiConfiguredException() {
        super("No ROI configured, call setRoi first");
    }
}
