package com.smartagriculture.spectra;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the per-sensor healthy baseline cache.
 */
public interface BaselineCacheInterface {
    /**
     * Returns the sensor's baseline, computing and persisting it on first use.
     * @param sensor Sensor whose baseline is requested
     * @param metadata Full metadata table
     * @param wavelengths Wavelengths of the spectrum about to be normalized, or null to skip the band-count check
     * @return The baseline values, or empty when no baseline-timepoint sample could be used
     * @throws BaselineMismatchException if the baseline's band count differs from {@code wavelengths.length}
     */
    Optional<double[]> getBaseline(Sensor sensor, List<SampleRecord> metadata, double[] wavelengths);

    /**
     * Builds every listed sensor's baseline up front.
     * @return Availability per sensor
     */
    Map<Sensor, Boolean> precompute(Collection<Sensor> sensors, List<SampleRecord> metadata);

    /**
     * @return Location of the sensor's persisted baseline file
     */
    Path baselineFile(Sensor sensor);
}
