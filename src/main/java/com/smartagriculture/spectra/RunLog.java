package com.smartagriculture.spectra;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-run outcome table of the export step, one row per sample. Rewritten on every run.
 */
public class RunLog {

    public enum Status { OK, ERR }

    /**
     * One sample outcome. For ERR rows reference and mode are "-" and {@code outPath} carries the failure reason.
     */
    public record Entry(Status status, String file, String sensor, String timepoint,
                        String refFileUsed, String normModeUsed, String outPath) {
        String[] toRow() {
            return new String[]{status.name(), file, sensor, timepoint, refFileUsed, normModeUsed, outPath};
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void ok(SampleRecord sample, NormalizationResult result, Path out) {
        entries.add(new Entry(Status.OK, sample.fileName(), sample.sensor().name(), sample.timepoint(),
            result.referenceId(), result.effectiveMode().name(), out.getFileName().toString()));
    }

    public void error(SampleRecord sample, String reason) {
        entries.add(new Entry(Status.ERR, sample.fileName(), sample.sensor().name(), sample.timepoint(),
            "-", "-", reason == null ? "" : reason));
    }

    /**
     * Writes the table, replacing the previous run's.
     */
    public void write(Path file) throws IOException {
        List<String[]> rows = new ArrayList<>(entries.size());
        for (Entry e : entries) rows.add(e.toRow());
        Utils.writeCsvAtomically(file, List.of(), TableSchemas.header(TableSchemas.runLogColumns()), rows);
    }
}
