package com.smartagriculture.spectra;

/**
 * Decoded hyperspectral cube indexed as {@code values[line][sample][band]}, plus one wavelength per band.
 *
 * @param values Reflectance values, shape [H][W][B]
 * @param wavelengths Band centre wavelengths in nanometres (or band indices when the header has none)
 */
public record HyperspectralCube(double[][][] values, double[] wavelengths) {

    public int bandCount() {
        return wavelengths.length;
    }
}
