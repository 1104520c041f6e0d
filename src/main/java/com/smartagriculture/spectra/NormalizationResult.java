package com.smartagriculture.spectra;

/**
 * Normalized spectrum plus the provenance written next to it.
 * <p>
 * {@code degraded} is true only when the strategy chosen by {@link ModeResolver} could not run and
 * {@link NormalizationMode#NONE} was applied instead. AUTO settling on ZSCORE is not a degradation.
 *
 * @param requestedMode Operator-configured mode (may be AUTO)
 * @param effectiveMode Mode actually applied and recorded; never AUTO
 * @param degraded Whether the resolved mode was downgraded to NONE
 * @param referenceId Cloth path, {@code BASELINE_<SENSOR>}, {@code ZSCORE} or {@code NONE}
 * @param values Normalized reflectance per band
 */
public record NormalizationResult(
    NormalizationMode requestedMode,
    NormalizationMode effectiveMode,
    boolean degraded,
    String referenceId,
    double[] values
) {
    public static final String ZSCORE_TAG = "ZSCORE";
    public static final String NONE_TAG = "NONE";

    public static String baselineTag(Sensor sensor) {
        return "BASELINE_" + sensor.name();
    }
}
