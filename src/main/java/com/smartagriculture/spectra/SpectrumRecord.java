package com.smartagriculture.spectra;

/**
 * Immutable record representing one band of one sample's normalized spectrum, i.e. one output row.
 * All records of a sample share sensor, timepoint, reference and mode.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public record SpectrumRecord(
    int bandIdx,
    double wavelengthNm,
    double reflNorm,
    Sensor sensor,
    String timepoint,
    String refFile,
    NormalizationMode normModeUsed
) {
    /**
     * Cells in the order of {@link TableSchemas#spectrumColumns()}.
     */
    public String[] toRow() {
        return new String[]{
            Integer.toString(bandIdx),
            Double.toString(wavelengthNm),
            Double.toString(reflNorm),
            sensor.name(),
            timepoint,
            refFile,
            normModeUsed.name()
        };
    }
}
