package com.smartagriculture.spectra;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for persisting one sample's normalized spectrum.
 */
public interface SpectrumWriterInterface {
    /**
     * Writes the spectrum table of one sample, replacing any previous one.
     * @param sample Sample the spectrum belongs to
     * @param wavelengths Band wavelengths
     * @param result Normalized values and provenance
     * @return Path of the written table
     * @throws IOException if writing fails; no partial table is left behind
     */
    Path write(SampleRecord sample, double[] wavelengths, NormalizationResult result) throws IOException;
}
