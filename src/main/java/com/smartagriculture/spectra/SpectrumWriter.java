package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for exporting normalized spectra to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Output file is {@code <stem>_spectrum.csv} in the output directory, where stem is the sample file name without its extension.</li>
 *   <li>First line is the annotation {@code # Normalization mode used: <MODE>}; every row repeats the mode in {@code norm_mode_used}.</li>
 *   <li>Rows are written through {@link Utils#writeCsvAtomically}, so a failure leaves no partial file.</li>
 *   <li>Numbers are formatted with {@link Double#toString(double)}, so identical inputs give byte-identical files.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class SpectrumWriter implements SpectrumWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(SpectrumWriter.class);

    private final Path outDir;

    public SpectrumWriter(Path outDir) {
        this.outDir = outDir;
    }

    @Override
    public Path write(SampleRecord sample, double[] wavelengths, NormalizationResult result) throws IOException {
        if (sample == null || result == null || wavelengths == null) {
            throw new IllegalArgumentException("Sample, wavelengths and result are required");
        }
        if (!result.effectiveMode().isResolved()) {
            throw new IllegalArgumentException("Refusing to write unresolved mode " + result.effectiveMode());
        }
        if (wavelengths.length != result.values().length) {
            throw new IllegalArgumentException("Wavelength count " + wavelengths.length + " differs from band count " + result.values().length);
        }

        List<String[]> rows = new ArrayList<>(wavelengths.length);
        for (SpectrumRecord rec : toRecords(sample, wavelengths, result)) {
            rows.add(rec.toRow());
        }
        Path out = outputPath(sample);
        Utils.writeCsvAtomically(out,
            List.of(TableSchemas.MODE_ANNOTATION_PREFIX + " " + result.effectiveMode().name()),
            TableSchemas.header(TableSchemas.spectrumColumns()),
            rows);
        logger.debug("Wrote {} bands ({}) to {}", rows.size(), result.effectiveMode(), out);
        return out;
    }

    /**
     * Output location of a sample's spectrum table.
     */
    public Path outputPath(SampleRecord sample) {
        return outDir.resolve(Utils.sanitizeFilename(Utils.fileStem(sample.path())) + TableSchemas.SPECTRUM_FILE_SUFFIX);
    }

    static List<SpectrumRecord> toRecords(SampleRecord sample, double[] wavelengths, NormalizationResult result) {
        List<SpectrumRecord> records = new ArrayList<>(wavelengths.length);
        for (int b = 0; b < wavelengths.length; b++) {
            records.add(new SpectrumRecord(b, wavelengths[b], result.values()[b], sample.sensor(),
                sample.timepoint(), result.referenceId(), result.effectiveMode()));
        }
        return records;
    }
}
