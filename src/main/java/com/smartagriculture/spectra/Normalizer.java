package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Applies a normalization strategy to a raw mean spectrum.
 * <p>
 * Strategies:
 * <ul>
 *   <li><b>CLOTH</b>: {@code clip(sample / max(reference, 1e-9), 0, 2.0)}.</li>
 *   <li><b>BASELINE</b>: the same formula against the sensor's healthy baseline.</li>
 *   <li><b>ZSCORE</b>: z-scores rescaled to [0, 1] by their own min and max; a flat spectrum gives zeros,
 *       a degenerate z-range gives a constant 0.5.</li>
 *   <li><b>NONE</b>: {@code clip(sample, 0, max(0, p99.9(sample)))}.</li>
 * </ul>
 * Every strategy function is total for equal-length vectors. {@link #normalize} downgrades CLOTH and BASELINE
 * to NONE when their reference spectrum is missing or of the wrong length, and marks the result degraded.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class Normalizer {
    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    public static final double EPSILON = 1e-9;
    public static final double RATIO_CEILING = 2.0;
    public static final double NONE_PERCENTILE = 99.9;

    /**
     * Runs the resolved strategy for one sample.
     * @param resolution Output of {@link ModeResolver#resolve}
     * @param sample Sample metadata, used for the baseline reference tag
     * @param spectrum Raw mean spectrum of the sample
     * @param clothSpectrum Mean spectrum of the chosen cloth reference, or null if it could not be loaded
     * @param baseline Sensor baseline, or null if absent
     * @return Normalized values with the mode and reference actually used
     */
    public NormalizationResult normalize(ModeResolution resolution, SampleRecord sample, double[] spectrum,
                                         double[] clothSpectrum, double[] baseline) {
        NormalizationMode requested = resolution.requestedMode();
        switch (resolution.effectiveMode()) {
            case CLOTH:
                if (usable(clothSpectrum, spectrum)) {
                    return new NormalizationResult(requested, NormalizationMode.CLOTH, false,
                        resolution.referencePath(), cloth(spectrum, clothSpectrum));
                }
                logger.warn("CLOTH reference unavailable for {} (ref={}); recording NONE", sample.path(), resolution.referencePath());
                return degraded(requested, spectrum);
            case BASELINE:
                if (usable(baseline, spectrum)) {
                    return new NormalizationResult(requested, NormalizationMode.BASELINE, false,
                        NormalizationResult.baselineTag(sample.sensor()), baseline(spectrum, baseline));
                }
                logger.warn("No {} baseline for {}; recording NONE", sample.sensor(), sample.path());
                return degraded(requested, spectrum);
            case ZSCORE:
                return new NormalizationResult(requested, NormalizationMode.ZSCORE, false,
                    NormalizationResult.ZSCORE_TAG, zscore(spectrum));
            default:
                return new NormalizationResult(requested, NormalizationMode.NONE, false,
                    NormalizationResult.NONE_TAG, none(spectrum));
        }
    }

    private static NormalizationResult degraded(NormalizationMode requested, double[] spectrum) {
        return new NormalizationResult(requested, NormalizationMode.NONE, true, NormalizationResult.NONE_TAG, none(spectrum));
    }

    private static boolean usable(double[] reference, double[] spectrum) {
        return reference != null && reference.length == spectrum.length;
    }

    /**
     * Divides by a cloth reference spectrum and clips to [0, 2.0].
     */
    public static double[] cloth(double[] sample, double[] reference) {
        return ratio(sample, reference);
    }

    /**
     * Divides by the healthy baseline spectrum and clips to [0, 2.0].
     */
    public static double[] baseline(double[] sample, double[] baseline) {
        return ratio(sample, baseline);
    }

    private static double[] ratio(double[] sample, double[] reference) {
        if (sample.length != reference.length) {
            throw new IllegalArgumentException("Sample has " + sample.length + " bands, reference has " + reference.length);
        }
        double[] out = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            double v = sample[i] / Math.max(reference[i], EPSILON);
            out[i] = Math.min(Math.max(v, 0.0), RATIO_CEILING);
        }
        return out;
    }

    /**
     * Z-scores the spectrum against itself and rescales to [0, 1].
     */
    public static double[] zscore(double[] sample) {
        double[] out = new double[sample.length];
        double std = SpectralMath.std(sample);
        if (std < EPSILON) {
            // flat spectrum
            return out;
        }
        double mean = SpectralMath.mean(sample);
        double[] z = new double[sample.length];
        for (int i = 0; i < sample.length; i++) z[i] = (sample[i] - mean) / std;
        double lo = SpectralMath.min(z);
        double range = SpectralMath.max(z) - lo;
        if (range < EPSILON) {
            Arrays.fill(out, 0.5);
            return out;
        }
        for (int i = 0; i < z.length; i++) out[i] = (z[i] - lo) / range;
        return out;
    }

    /**
     * Clips the raw spectrum to [0, p99.9]. The upper bound is never below zero.
     */
    public static double[] none(double[] sample) {
        double upper = Math.max(0.0, SpectralMath.percentile(sample, NONE_PERCENTILE));
        double[] out = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            out[i] = Math.min(Math.max(sample[i], 0.0), upper);
        }
        return out;
    }
}
