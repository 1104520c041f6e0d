package com.smartagriculture.spectra;

import java.util.Arrays;
import java.util.List;

/**
 * Numeric helpers for reducing cubes to spectra and summarising spectra.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #reduce(HyperspectralCube)} collapses the two spatial axes of a cube into one mean spectrum.</li>
 *   <li>NaN entries are skipped, never counted as zero; a band with no non-NaN value reduces to NaN.</li>
 *   <li>{@link #nanMeanOf(List)} averages several spectra band-wise with the same NaN semantics (baseline building).</li>
 *   <li>{@link #mean}, {@link #std} and {@link #percentile} back the normalization strategies.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public final class SpectralMath {
    private SpectralMath() {}

    /**
     * Mean spectrum of a cube over its spatial axes.
     * @param cube Cube to reduce
     * @return One value per band
     */
    public static double[] reduce(HyperspectralCube cube) {
        return reduce(cube.values());
    }

    /**
     * Mean spectrum of a {@code [H][W][B]} array over its first two axes, skipping NaN entries.
     * @param values Cube values
     * @return One value per band
     */
    public static double[] reduce(double[][][] values) {
        if (values.length == 0 || values[0].length == 0) {
            return new double[0];
        }
        int bands = values[0][0].length;
        double[] sums = new double[bands];
        long[] counts = new long[bands];
        for (double[][] line : values) {
            for (double[] pixel : line) {
                for (int b = 0; b < bands; b++) {
                    double v = pixel[b];
                    if (!Double.isNaN(v)) {
                        sums[b] += v;
                        counts[b]++;
                    }
                }
            }
        }
        double[] out = new double[bands];
        for (int b = 0; b < bands; b++) {
            out[b] = counts[b] == 0 ? Double.NaN : sums[b] / counts[b];
        }
        return out;
    }

    /**
     * Band-wise mean of several equal-length spectra, skipping NaN entries.
     * @param spectra Spectra to average; must be non-empty and of equal length
     * @return Averaged spectrum
     */
    public static double[] nanMeanOf(List<double[]> spectra) {
        if (spectra == null || spectra.isEmpty()) {
            throw new IllegalArgumentException("At least one spectrum is required");
        }
        int bands = spectra.get(0).length;
        double[] sums = new double[bands];
        int[] counts = new int[bands];
        for (double[] spectrum : spectra) {
            if (spectrum.length != bands) {
                throw new IllegalArgumentException("Spectra differ in band count: " + spectrum.length + " vs " + bands);
            }
            for (int b = 0; b < bands; b++) {
                if (!Double.isNaN(spectrum[b])) {
                    sums[b] += spectrum[b];
                    counts[b]++;
                }
            }
        }
        double[] out = new double[bands];
        for (int b = 0; b < bands; b++) {
            out[b] = counts[b] == 0 ? Double.NaN : sums[b] / counts[b];
        }
        return out;
    }

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Mean of the non-NaN entries, or NaN when there are none.
     */
    public static double nanMean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /**
     * Population standard deviation.
     */
    public static double std(double[] values) {
        if (values.length == 0) return Double.NaN;
        double m = mean(values);
        double acc = 0;
        for (double v : values) {
            double d = v - m;
            acc += d * d;
        }
        return Math.sqrt(acc / values.length);
    }

    /**
     * Percentile with linear interpolation between the closest ranks.
     * @param values Input values; any NaN makes the result NaN
     * @param q Percentile in [0, 100]
     */
    public static double percentile(double[] values, double q) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        // Arrays.sort orders NaN last
        if (Double.isNaN(sorted[sorted.length - 1])) return Double.NaN;
        double rank = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }

    public static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    public static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }
}
