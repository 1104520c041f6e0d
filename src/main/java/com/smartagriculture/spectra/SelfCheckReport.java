package com.smartagriculture.spectra;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured result of a self-check run. Serialized as JSON by {@link SelfCheckValidator}.
 *
 * @param status PASS or FAIL
 * @param failedStage Stage that failed, or null on PASS
 * @param error Failing condition, or null on PASS
 * @param configuredMode Mode the pipeline was configured with
 * @param metaRows Rows in the metadata table
 * @param sensorCounts Non-reference samples per sensor
 * @param timepointCounts Non-reference samples per timepoint
 * @param spectraFiles Spectrum tables validated
 * @param totalRows Data rows across all spectrum tables
 * @param perSensorMean Mean reflectance per sensor, averaged over that sensor's files
 * @param modeCounts Spectrum tables per recorded mode
 * @param warnings Non-fatal findings
 */
public record SelfCheckReport(
    Status status,
    SelfCheckStage failedStage,
    String error,
    NormalizationMode configuredMode,
    int metaRows,
    Map<String, Integer> sensorCounts,
    Map<String, Integer> timepointCounts,
    int spectraFiles,
    int totalRows,
    Map<String, Double> perSensorMean,
    Map<String, Integer> modeCounts,
    List<String> warnings
) {
    public enum Status { PASS, FAIL }

    public boolean passed() {
        return status == Status.PASS;
    }

    public int exitCode() {
        return passed() ? 0 : 1;
    }

    /**
     * Human readable report block, one entry per line.
     */
    public List<String> render() {
        List<String> lines = new ArrayList<>();
        lines.add("SELF-CHECK REPORT");
        lines.add("status=" + status);
        if (!passed()) {
            lines.add("failed_stage=" + failedStage);
            lines.add("error=" + error);
        }
        lines.add("configured_mode=" + configuredMode);
        lines.add("meta_rows=" + metaRows);
        lines.add("spectra_files=" + spectraFiles);
        lines.add("spectra_rows=" + totalRows);
        lines.add("sensors=" + Utils.formatCounts(sensorCounts));
        lines.add("timepoints=" + Utils.formatCounts(timepointCounts));
        lines.add("norm_modes_used=" + Utils.formatCounts(modeCounts));
        if (!perSensorMean.isEmpty()) {
            StringBuilder sb = new StringBuilder("per_sensor_mean={");
            String sep = "";
            for (Map.Entry<String, Double> e : new TreeMap<>(perSensorMean).entrySet()) {
                sb.append(sep).append('\'').append(e.getKey()).append("': ").append(String.format(Locale.ROOT, "%.4f", e.getValue()));
                sep = ", ";
            }
            lines.add(sb.append('}').toString());
        }
        if (!warnings.isEmpty()) {
            lines.add("");
            lines.add("WARNINGS:");
            for (String w : warnings) lines.add("- " + w);
        }
        return lines;
    }
}
