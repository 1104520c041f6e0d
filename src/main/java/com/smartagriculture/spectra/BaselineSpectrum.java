package com.smartagriculture.spectra;

/**
 * Healthy reference spectrum of one sensor.
 *
 * @param key Cache identity; {@code null} digest for files written without a key line
 * @param wavelengths Band wavelengths
 * @param values Band-wise mean reflectance
 */
public record BaselineSpectrum(BaselineKey key, double[] wavelengths, double[] values) {

    public int bandCount() {
        return values.length;
    }
}
