package com.smartagriculture.spectra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Independent audit of a finished export: re-reads the metadata table and every spectrum table and checks them
 * against the bounds of the mode each table declares.
 * <p>
 * Workflow:
 * <ul>
 *   <li><b>LOAD_METADATA</b>: the metadata table must exist and parse.</li>
 *   <li><b>VALIDATE_METADATA</b>: non-empty, all columns present, at least one non-reference sample, and non-reference samples of both VISNIR and SWIR.</li>
 *   <li><b>VALIDATE_OUTPUTS</b>: at least 3 spectrum tables; per table all columns present, header annotation equal to the single mode found in
 *       {@code norm_mode_used}, finite reflectance, CLOTH/BASELINE within [0, 2.0], ZSCORE within [0, 1], NONE unconstrained.</li>
 *   <li><b>POLICY_CHECK</b>: configured CLOTH needs at least one CLOTH table, configured BASELINE needs a baseline file,
 *       configured AUTO warns when the ZSCORE share exceeds {@link PipelineConfig#zscoreWarnRatio()}.</li>
 *   <li><b>REPORT</b>: prints the report block, writes {@code self_check_report.json} and appends a trace log line, on PASS and FAIL alike.</li>
 * </ul>
 * Validation failures never escape as exceptions; they produce a FAIL report with exit code 1.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class SelfCheckValidator {
    private static final Logger logger = LoggerFactory.getLogger(SelfCheckValidator.class);

    private static final double RATIO_MIN = 0.0;
    private static final double RATIO_MAX = Normalizer.RATIO_CEILING;
    private static final int MIN_SPECTRA_FILES = 3;

    private final PrintStream console;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SelfCheckValidator() {
        this(System.out);
    }

    public SelfCheckValidator(PrintStream console) {
        this.console = console;
    }

    record MetaStats(int rows, Map<String, Integer> sensorCounts, Map<String, Integer> timepointCounts) {
        static final MetaStats EMPTY = new MetaStats(0, Map.of(), Map.of());
    }

    record SpectraStats(List<Path> files, int totalRows, Map<String, Double> perSensorMean, Map<String, Integer> modeCounts) {
        static final SpectraStats EMPTY = new SpectraStats(List.of(), 0, Map.of(), Map.of());
    }

    /**
     * Runs every stage and emits the report.
     * @param config Configuration the export ran with
     * @return PASS or FAIL report
     */
    public SelfCheckReport run(PipelineConfig config) {
        SelfCheckStage stage = SelfCheckStage.LOAD_METADATA;
        MetaStats meta = MetaStats.EMPTY;
        SpectraStats spectra = SpectraStats.EMPTY;
        List<String> warnings = new ArrayList<>();
        SelfCheckReport.Status status = SelfCheckReport.Status.PASS;
        SelfCheckStage failedStage = null;
        String error = null;

        try {
            AnnotatedTable table = loadMetadata(config.metadataPath());
            stage = SelfCheckStage.VALIDATE_METADATA;
            meta = validateMetadata(table);
            stage = SelfCheckStage.VALIDATE_OUTPUTS;
            spectra = validateOutputs(config.outDir());
            stage = SelfCheckStage.POLICY_CHECK;
            warnings.addAll(checkPolicy(config, spectra));
        } catch (SelfCheckException e) {
            status = SelfCheckReport.Status.FAIL;
            failedStage = e.getStage();
            error = e.getMessage();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure during {}", stage, e);
            status = SelfCheckReport.Status.FAIL;
            failedStage = stage;
            error = "Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        SelfCheckReport report = new SelfCheckReport(status, failedStage, error, config.normMode(),
            meta.rows(), meta.sensorCounts(), meta.timepointCounts(),
            spectra.files().size(), spectra.totalRows(), spectra.perSensorMean(), spectra.modeCounts(), warnings);
        emit(config, report);
        return report;
    }

    AnnotatedTable loadMetadata(Path metadataPath) throws SelfCheckException {
        if (!Files.exists(metadataPath)) {
            throw new SelfCheckException(SelfCheckStage.LOAD_METADATA,
                "Missing " + metadataPath.getFileName() + ". Run the inventory step first.");
        }
        try {
            return AnnotatedTable.read(metadataPath);
        } catch (IOException e) {
            throw new SelfCheckException(SelfCheckStage.LOAD_METADATA, "Cannot read " + metadataPath + ": " + e.getMessage());
        }
    }

    MetaStats validateMetadata(AnnotatedTable table) throws SelfCheckException {
        SelfCheckStage stage = SelfCheckStage.VALIDATE_METADATA;
        if (table.header().isEmpty() || table.rows().isEmpty()) {
            throw new SelfCheckException(stage, "Metadata table is empty; rerun the inventory step with valid raw data.");
        }
        List<String> missing = TableSchemas.missingColumns(TableSchemas.metadataColumns(), table.header());
        if (!missing.isEmpty()) {
            throw new SelfCheckException(stage, "Metadata table missing required columns: " + String.join(", ", missing));
        }

        List<String> isRef = table.column(TableSchemas.IS_REF);
        List<String> sensors = table.column(TableSchemas.SENSOR);
        List<String> timepoints = table.column(TableSchemas.TIMEPOINT);
        Map<String, Integer> sensorCounts = new TreeMap<>();
        Map<String, Integer> timepointCounts = new TreeMap<>();
        for (int i = 0; i < table.rows().size(); i++) {
            if (MetadataTableReader.parseFlag(isRef.get(i))) continue;
            sensorCounts.merge(sensors.get(i).toUpperCase(Locale.ROOT), 1, Integer::sum);
            timepointCounts.merge(timepoints.get(i), 1, Integer::sum);
        }
        if (sensorCounts.isEmpty()) {
            throw new SelfCheckException(stage, "No non-cloth samples found in the metadata table");
        }
        if (sensorCounts.getOrDefault(Sensor.VISNIR.name(), 0) == 0 || sensorCounts.getOrDefault(Sensor.SWIR.name(), 0) == 0) {
            throw new SelfCheckException(stage, "Need at least one non-cloth VISNIR and SWIR sample, found " + Utils.formatCounts(sensorCounts));
        }
        return new MetaStats(table.rows().size(), sensorCounts, timepointCounts);
    }

    SpectraStats validateOutputs(Path outDir) throws SelfCheckException {
        SelfCheckStage stage = SelfCheckStage.VALIDATE_OUTPUTS;
        List<Path> files = listSpectrumFiles(outDir);
        if (files.size() < MIN_SPECTRA_FILES) {
            throw new SelfCheckException(stage, "Found " + files.size() + " *" + TableSchemas.SPECTRUM_FILE_SUFFIX
                + " files, need at least " + MIN_SPECTRA_FILES + ". Re-run the export step.");
        }

        Map<String, List<Double>> sensorMeans = new TreeMap<>();
        Map<String, Integer> modeCounts = new TreeMap<>();
        int totalRows = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            AnnotatedTable table;
            try {
                table = AnnotatedTable.read(file);
            } catch (IOException e) {
                throw new SelfCheckException(stage, name + " cannot be read: " + e.getMessage());
            }
            List<String> missing = TableSchemas.missingColumns(TableSchemas.spectrumColumns(), table.header());
            if (!missing.isEmpty()) {
                throw new SelfCheckException(stage, name + " missing columns: " + String.join(", ", missing));
            }

            String headerMode = annotatedMode(table.comments());
            Set<String> rowModes = new LinkedHashSet<>(table.column(TableSchemas.NORM_MODE_USED));
            if (rowModes.size() != 1 || !rowModes.contains(headerMode)) {
                throw new SelfCheckException(stage, "Inconsistent norm_mode_used in " + name
                    + ". Header: " + headerMode + ", Column: " + rowModes);
            }
            NormalizationMode mode;
            try {
                mode = NormalizationMode.valueOf(headerMode);
            } catch (IllegalArgumentException e) {
                throw new SelfCheckException(stage, name + " declares unknown mode " + headerMode);
            }
            if (!mode.isResolved()) {
                throw new SelfCheckException(stage, name + " declares unresolved mode " + mode);
            }

            double[] refl = parseReflectance(name, table.column(TableSchemas.REFL_NORM));
            for (double v : refl) {
                if (!Double.isFinite(v)) {
                    throw new SelfCheckException(stage, name + " contains NaN or Inf reflectance values.");
                }
            }
            checkRange(name, mode, refl);

            modeCounts.merge(mode.name(), 1, Integer::sum);
            String sensor = table.column(TableSchemas.SENSOR).get(0);
            sensorMeans.computeIfAbsent(sensor, k -> new ArrayList<>()).add(SpectralMath.nanMean(refl));
            totalRows += table.rows().size();
        }

        Map<String, Double> perSensorMean = new TreeMap<>();
        sensorMeans.forEach((sensor, means) ->
            perSensorMean.put(sensor, SpectralMath.mean(means.stream().mapToDouble(Double::doubleValue).toArray())));
        logger.info("Validated {} spectrum tables ({} rows), modes {}", files.size(), totalRows, modeCounts);
        return new SpectraStats(files, totalRows, perSensorMean, modeCounts);
    }

    List<String> checkPolicy(PipelineConfig config, SpectraStats spectra) throws SelfCheckException {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        NormalizationMode configured = config.normMode();

        if (configured == NormalizationMode.CLOTH && spectra.modeCounts().getOrDefault(NormalizationMode.CLOTH.name(), 0) == 0) {
            errors.add("Configured mode is CLOTH, but no CLOTH rows produced.");
        }
        if (configured == NormalizationMode.BASELINE && !hasBaselineFile(config.outDir())) {
            errors.add("Configured mode is BASELINE, but no baseline_<SENSOR>.csv file was found.");
        }
        if (configured == NormalizationMode.AUTO) {
            int total = spectra.files().size();
            int zscore = spectra.modeCounts().getOrDefault(NormalizationMode.ZSCORE.name(), 0);
            if (total > 0 && (double) zscore / total > config.zscoreWarnRatio()) {
                warnings.add(String.format(Locale.ROOT, "%.0f%% of files used ZSCORE fallback. Check calibration cloth captures and lighting conditions.",
                    100.0 * zscore / total));
            }
        }
        if (!errors.isEmpty()) {
            throw new SelfCheckException(SelfCheckStage.POLICY_CHECK, String.join("\n", errors));
        }
        return warnings;
    }

    private void checkRange(String name, NormalizationMode mode, double[] refl) throws SelfCheckException {
        double lo;
        double hi;
        switch (mode) {
            case CLOTH, BASELINE -> {
                lo = RATIO_MIN;
                hi = RATIO_MAX;
            }
            case ZSCORE -> {
                lo = 0.0;
                hi = 1.0;
            }
            default -> {
                return;
            }
        }
        for (double v : refl) {
            if (v < lo || v > hi) {
                throw new SelfCheckException(SelfCheckStage.VALIDATE_OUTPUTS,
                    String.format(Locale.ROOT, "%s (mode: %s) has reflectance outside [%s, %s].", name, mode, lo, hi));
            }
        }
    }

    private static double[] parseReflectance(String name, List<String> cells) throws SelfCheckException {
        double[] out = new double[cells.size()];
        for (int i = 0; i < out.length; i++) {
            try {
                out[i] = Double.parseDouble(cells.get(i));
            } catch (NumberFormatException e) {
                throw new SelfCheckException(SelfCheckStage.VALIDATE_OUTPUTS,
                    name + " has a non-numeric reflectance value '" + cells.get(i) + "' in data row " + (i + 1));
            }
        }
        return out;
    }

    static String annotatedMode(List<String> comments) {
        for (String c : comments) {
            if (c.contains("Normalization mode used")) {
                return c.substring(c.lastIndexOf(':') + 1).trim();
            }
        }
        return "UNKNOWN";
    }

    private static List<Path> listSpectrumFiles(Path outDir) throws SelfCheckException {
        if (!Files.isDirectory(outDir)) return List.of();
        try (Stream<Path> list = Files.list(outDir)) {
            return list.filter(p -> p.getFileName().toString().endsWith(TableSchemas.SPECTRUM_FILE_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SelfCheckException(SelfCheckStage.VALIDATE_OUTPUTS, "Cannot list " + outDir + ": " + e.getMessage());
        }
    }

    private static boolean hasBaselineFile(Path outDir) throws SelfCheckException {
        if (!Files.isDirectory(outDir)) return false;
        try (Stream<Path> list = Files.list(outDir)) {
            return list.anyMatch(p -> {
                String n = p.getFileName().toString();
                return n.startsWith("baseline_") && n.endsWith(".csv");
            });
        } catch (IOException e) {
            throw new SelfCheckException(SelfCheckStage.POLICY_CHECK, "Cannot list " + outDir + ": " + e.getMessage());
        }
    }

    private void emit(PipelineConfig config, SelfCheckReport report) {
        for (String line : report.render()) console.println(line);

        try {
            Files.createDirectories(config.reportsDir());
            mapper.writeValue(config.selfCheckReportPath().toFile(), report);
        } catch (IOException e) {
            logger.error("Failed to write self-check report {}: {}", config.selfCheckReportPath(), e.getMessage());
        }

        Map<String, String> trace = new LinkedHashMap<>();
        trace.put("status", report.status().name());
        trace.put("meta_rows", Integer.toString(report.metaRows()));
        trace.put("spectra_count", Integer.toString(report.spectraFiles()));
        trace.put("spectra_rows", Integer.toString(report.totalRows()));
        trace.put("modes", Utils.formatCounts(report.modeCounts()));
        try {
            new TraceLog(config.traceLogPath()).append("self_check", trace);
        } catch (IOException e) {
            logger.error("Failed to append to trace log {}: {}", config.traceLogPath(), e.getMessage());
        }
        if (report.passed()) {
            logger.info("Self-check PASS ({} files)", report.spectraFiles());
        } else {
            logger.warn("Self-check FAIL at {}: {}", report.failedStage(), report.error());
        }
    }
}
