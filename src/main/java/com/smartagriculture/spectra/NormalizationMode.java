package com.smartagriculture.spectra;

import java.util.Locale;

/**
 * Normalization strategies applied to a raw mean spectrum.
 * <p>
 * {@link #AUTO} is a meta-value: it is resolved per sample by {@link ModeResolver} and never
 * written to an output table. {@link #NONE} is only ever the result of a degradation, it cannot
 * be configured.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public enum NormalizationMode {
    /** Divide by a calibration-cloth spectrum, clipped to [0, 2.0]. */
    CLOTH,
    /** Divide by the sensor's healthy baseline spectrum, clipped to [0, 2.0]. */
    BASELINE,
    /** Z-score the spectrum against itself and rescale into [0, 1]. */
    ZSCORE,
    /** Raw spectrum clipped to [0, p99.9]; no relative scale guarantee. */
    NONE,
    /** Pick per sample along CLOTH, BASELINE, ZSCORE. */
    AUTO;

    /**
     * @return true if this value may appear as {@code norm_mode_used} in an output row
     */
    public boolean isResolved() {
        return this != AUTO;
    }

    /**
     * @return true if this value is an accepted operator setting
     */
    public boolean isConfigurable() {
        return this != NONE;
    }

    /**
     * Parses a configured mode label.
     * @param value Label such as "auto" or "CLOTH"
     * @return Parsed mode
     * @throws IllegalArgumentException if the label is blank, unknown, or {@code NONE}
     */
    public static NormalizationMode parseConfigured(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Normalization mode cannot be null or empty");
        }
        NormalizationMode mode;
        try {
            mode = valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown normalization mode: " + value, e);
        }
        if (!mode.isConfigurable()) {
            throw new IllegalArgumentException("Normalization mode " + mode + " cannot be configured; use AUTO, CLOTH, BASELINE or ZSCORE");
        }
        return mode;
    }
}
