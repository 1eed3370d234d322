package com.signalsync.shared.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Which of the two ROI segments get band-passed before peak detection.
 */
@Getter
@RequiredArgsConstructor
public enum FilterMode {
    DEFAULT("default", true, true),
    PPG_ECG("ppg_ecg", true, true),
    PPG_ONLY("ppg_only", true, false),
    OFF("off", false, false);

    private final String label;
    private final boolean filterPpg;
    private final boolean filterEcg;

    /**
     * Resolves a mode by its label. Unknown labels and {@code null} fall back to {@link #OFF}.
     */
    public static FilterMode fromLabel(String label) {
        if (label != null) {
            for (FilterMode mode : values()) {
                if (mode.label.equals(label)) {
                    return mode;
                }
            }
        }
        return OFF;
    }
}
