package com.smartagriculture.spectra;

/**
 * Outcome of mode resolution for one sample, before normalization runs.
 *
 * @param requestedMode Operator-configured mode (may be AUTO)
 * @param effectiveMode Mode selected for execution; never AUTO
 * @param referencePath Cloth reference chosen for the sample, or null when none exists
 */
public record ModeResolution(NormalizationMode requestedMode, NormalizationMode effectiveMode, String referencePath) {

    public ModeResolution {
        if (effectiveMode == null || !effectiveMode.isResolved()) {
            throw new IllegalArgumentException("Effective mode must be resolved, got " + effectiveMode);
        }
    }
}
