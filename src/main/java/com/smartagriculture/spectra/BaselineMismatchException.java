package com.smartagriculture.spectra;

import java.nio.file.Path;

/**
 * Raised when a sensor's baseline has a different band count from the spectra being normalized.
 * Fatal for the run: the operator must delete the baseline file so it is rebuilt.
 */
public class BaselineMismatchException extends IllegalStateException {
    private final Sensor sensor;

    public BaselineMismatchException(Sensor sensor, Path baselineFile, int baselineBands, int sampleBands) {
        super(String.format("Baseline for %s (%s) has %d bands but samples have %d; delete the file to rebuild it",
            sensor, baselineFile, baselineBands, sampleBands));
        this.sensor = sensor;
    }

    public Sensor getSensor() {
        return sensor;
    }
}
