package com.smartagriculture.spectra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable configuration for one pipeline invocation.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Start from {@link #defaults()}.</li>
 *   <li>Overlay an optional JSON file named by {@code SMARTAGRI_CONFIG} (read with Jackson).</li>
 *   <li>Overlay each {@code SMARTAGRI_*} setting from a system property, falling back to the environment variable of the same name.</li>
 *   <li>The resulting value is passed explicitly to every resolver, normalizer and validator call; nothing reads settings after startup.</li>
 * </ul>
 *
 * @param normMode Configured normalization mode (AUTO, CLOTH, BASELINE or ZSCORE)
 * @param baselineTimepoint Timepoint label considered the healthy baseline, e.g. "D0"
 * @param dataDir Root of the raw cubes
 * @param outDir Directory holding the metadata table, baseline files and spectrum files
 * @param reportsDir Directory holding the run log, trace log and self-check report
 * @param baselineIntegrityCheck Recompute a persisted baseline whose recorded sources differ from the current ones
 * @param zscoreWarnRatio Share of ZSCORE files above which an AUTO self-check warns
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public record PipelineConfig(
    NormalizationMode normMode,
    String baselineTimepoint,
    Path dataDir,
    Path outDir,
    Path reportsDir,
    boolean baselineIntegrityCheck,
    double zscoreWarnRatio
) {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String CONFIG_FILE = "SMARTAGRI_CONFIG";
    public static final String NORM_MODE = "SMARTAGRI_NORM_MODE";
    public static final String BASELINE_TIMEPOINT = "SMARTAGRI_BASELINE_TIMEPOINT";
    public static final String DATA_DIR = "SMARTAGRI_DATA_DIR";
    public static final String OUT_DIR = "SMARTAGRI_OUT_DIR";
    public static final String REPORTS_DIR = "SMARTAGRI_REPORTS_DIR";
    public static final String BASELINE_INTEGRITY_CHECK = "SMARTAGRI_BASELINE_INTEGRITY_CHECK";

    public PipelineConfig {
        if (normMode == null || !normMode.isConfigurable()) {
            throw new IllegalArgumentException("Configured normalization mode must be AUTO, CLOTH, BASELINE or ZSCORE, got " + normMode);
        }
        if (baselineTimepoint == null || baselineTimepoint.isBlank()) {
            throw new IllegalArgumentException("Baseline timepoint cannot be null or empty");
        }
        if (dataDir == null || outDir == null || reportsDir == null) {
            throw new IllegalArgumentException("Data, output and reports directories are required");
        }
        if (!(zscoreWarnRatio >= 0.0 && zscoreWarnRatio <= 1.0)) {
            throw new IllegalArgumentException("zscoreWarnRatio must be within [0, 1], got " + zscoreWarnRatio);
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(
            NormalizationMode.AUTO,
            "D0",
            Paths.get("data/tomato_leaf"),
            Paths.get("data_processed"),
            Paths.get("reports"),
            false,
            0.25
        );
    }

    /**
     * Loads the configuration from the JVM system properties and the process environment.
     */
    public static PipelineConfig fromEnvironment() throws IOException {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * Loads the configuration from explicit property and environment sources.
     * @param properties System properties; take precedence over {@code env}
     * @param env Environment variables
     * @return Resolved configuration
     * @throws IOException if a named JSON config file cannot be read
     * @throws IllegalArgumentException if a setting has an invalid value
     */
    public static PipelineConfig load(Properties properties, Map<String, String> env) throws IOException {
        PipelineConfig config = defaults();
        String configFile = setting(properties, env, CONFIG_FILE);
        if (configFile != null) {
            config = config.overlayJson(Paths.get(configFile));
        }

        String mode = setting(properties, env, NORM_MODE);
        String timepoint = setting(properties, env, BASELINE_TIMEPOINT);
        String dataDir = setting(properties, env, DATA_DIR);
        String outDir = setting(properties, env, OUT_DIR);
        String reportsDir = setting(properties, env, REPORTS_DIR);
        String integrity = setting(properties, env, BASELINE_INTEGRITY_CHECK);

        PipelineConfig resolved = new PipelineConfig(
            mode != null ? NormalizationMode.parseConfigured(mode) : config.normMode(),
            timepoint != null ? timepoint.trim() : config.baselineTimepoint(),
            dataDir != null ? Paths.get(dataDir) : config.dataDir(),
            outDir != null ? Paths.get(outDir) : config.outDir(),
            reportsDir != null ? Paths.get(reportsDir) : config.reportsDir(),
            integrity != null ? Boolean.parseBoolean(integrity.trim()) : config.baselineIntegrityCheck(),
            config.zscoreWarnRatio()
        );
        logger.info("Pipeline configuration: mode={}, baselineTimepoint={}, outDir={}, reportsDir={}",
            resolved.normMode(), resolved.baselineTimepoint(), resolved.outDir(), resolved.reportsDir());
        return resolved;
    }

    /**
     * Returns a copy of this configuration with the fields present in a JSON file replacing the current values.
     * Recognised keys: normMode, baselineTimepoint, dataDir, outDir, reportsDir, baselineIntegrityCheck, zscoreWarnRatio.
     * @param jsonFile JSON object file
     * @throws IOException if the file is missing or not valid JSON
     */
    public PipelineConfig overlayJson(Path jsonFile) throws IOException {
        if (!Files.exists(jsonFile)) {
            throw new IOException("Configuration file not found: " + jsonFile);
        }
        JsonNode root = new ObjectMapper().readTree(jsonFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Configuration file is not a JSON object: " + jsonFile);
        }
        logger.info("Loaded configuration overrides from {}", jsonFile);
        return new PipelineConfig(
            root.hasNonNull("normMode") ? NormalizationMode.parseConfigured(root.get("normMode").asText()) : normMode,
            root.hasNonNull("baselineTimepoint") ? root.get("baselineTimepoint").asText().trim() : baselineTimepoint,
            root.hasNonNull("dataDir") ? Paths.get(root.get("dataDir").asText()) : dataDir,
            root.hasNonNull("outDir") ? Paths.get(root.get("outDir").asText()) : outDir,
            root.hasNonNull("reportsDir") ? Paths.get(root.get("reportsDir").asText()) : reportsDir,
            root.hasNonNull("baselineIntegrityCheck") ? root.get("baselineIntegrityCheck").asBoolean() : baselineIntegrityCheck,
            root.hasNonNull("zscoreWarnRatio") ? root.get("zscoreWarnRatio").asDouble() : zscoreWarnRatio
        );
    }

    public PipelineConfig withNormMode(NormalizationMode mode) {
        return new PipelineConfig(mode, baselineTimepoint, dataDir, outDir, reportsDir, baselineIntegrityCheck, zscoreWarnRatio);
    }

    /**
     * Returns a copy with data, output and reports directories placed under one root.
     */
    public PipelineConfig withRoot(Path root) {
        return new PipelineConfig(normMode, baselineTimepoint, root.resolve("data"), root.resolve("data_processed"),
            root.resolve("reports"), baselineIntegrityCheck, zscoreWarnRatio);
    }

    public boolean isBaselineTimepoint(String timepoint) {
        return baselineTimepoint.equals(timepoint);
    }

    public Path metadataPath() {
        return outDir.resolve(TableSchemas.METADATA_FILE);
    }

    public Path runLogPath() {
        return reportsDir.resolve("export_spectra_run.csv");
    }

    public Path traceLogPath() {
        return reportsDir.resolve("trace_log.txt");
    }

    public Path selfCheckReportPath() {
        return reportsDir.resolve("self_check_report.json");
    }

    private static String setting(Properties properties, Map<String, String> env, String name) {
        String value = properties.getProperty(name, env.get(name));
        return value == null || value.isBlank() ? null : value;
    }
}
