package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Export step: turns every non-reference sample of the metadata table into a normalized spectrum file.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads the metadata table; a missing table aborts the run before any processing.</li>
 *   <li>Builds the baseline of every sensor present among the samples before the per-sample loop, when the configured mode can use one.
 *       Baselines are read-only for the rest of the run.</li>
 *   <li>For each sample in table order: load and reduce the cube, resolve the mode, load the cloth reference if one was chosen,
 *       normalize, write the spectrum table.</li>
 *   <li>Per-sample failures print {@code [ERR] <path>: <reason>}, are recorded in the run log and do not stop the batch.</li>
 *   <li>A baseline band-count mismatch is not per-sample: it aborts the run.</li>
 *   <li>Finally rewrites the run log and appends one trace log line. An aborted run still records the samples handled
 *       before the abort and adds an {@code aborted} field to its trace line.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class SpectrumExporter {
    private static final Logger logger = LoggerFactory.getLogger(SpectrumExporter.class);

    private final CubeLoaderInterface loader;
    private final MetadataTableReader metadataReader;
    private final ModeResolver resolver;
    private final Normalizer normalizer;
    private final PrintStream console;

    public SpectrumExporter(CubeLoaderInterface loader) {
        this(loader, new MetadataTableReader(), new ModeResolver(), new Normalizer(), System.out);
    }

    public SpectrumExporter(CubeLoaderInterface loader, MetadataTableReader metadataReader, ModeResolver resolver,
                            Normalizer normalizer, PrintStream console) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.metadataReader = metadataReader;
        this.resolver = resolver;
        this.normalizer = normalizer;
        this.console = console;
    }

    /**
     * Runs the export with a fresh baseline cache and the default spectrum writer.
     * @param config Pipeline configuration
     * @return Run totals
     * @throws IOException if the metadata table is missing or unreadable, or the run log cannot be written
     * @throws BaselineMismatchException if a persisted baseline does not match the samples' band count
     */
    public ExportSummary export(PipelineConfig config) throws IOException {
        return export(config, new BaselineCache(config, loader), new SpectrumWriter(config.outDir()));
    }

    public ExportSummary export(PipelineConfig config, BaselineCacheInterface baselines, SpectrumWriterInterface writer) throws IOException {
        List<SampleRecord> metadata = metadataReader.read(config.metadataPath());
        List<SampleRecord> samples = metadata.stream().filter(r -> !r.isReference()).toList();
        logger.info("Exporting {} samples ({} references) with mode {}", samples.size(), metadata.size() - samples.size(), config.normMode());

        Map<Sensor, Boolean> baselineAvailable = new EnumMap<>(Sensor.class);
        if (config.normMode() == NormalizationMode.AUTO || config.normMode() == NormalizationMode.BASELINE) {
            Set<Sensor> sensors = EnumSet.noneOf(Sensor.class);
            for (SampleRecord s : samples) sensors.add(s.sensor());
            baselineAvailable.putAll(baselines.precompute(sensors, metadata));
        }

        RunLog runLog = new RunLog();
        Map<String, double[]> referenceSpectra = new HashMap<>();
        Map<String, Integer> modeCounts = new TreeMap<>();
        List<Path> outputs = new ArrayList<>();
        int failed = 0;
        int degraded = 0;

        try {
            for (SampleRecord sample : samples) {
                try {
                    HyperspectralCube cube = loader.load(sample.path());
                    double[] spectrum = SpectralMath.reduce(cube);
                    if (spectrum.length != cube.wavelengths().length) {
                        throw new IOException("cube has " + spectrum.length + " bands but " + cube.wavelengths().length + " wavelengths");
                    }

                    ModeResolution resolution = resolver.resolve(config, sample, metadata, baselineAvailable);
                    double[] cloth = null;
                    if (resolution.effectiveMode() == NormalizationMode.CLOTH && resolution.referencePath() != null) {
                        cloth = referenceSpectrum(resolution.referencePath(), referenceSpectra);
                    }
                    double[] baseline = null;
                    if (resolution.effectiveMode() == NormalizationMode.BASELINE) {
                        baseline = baselines.getBaseline(sample.sensor(), metadata, cube.wavelengths()).orElse(null);
                    }

                    NormalizationResult result = normalizer.normalize(resolution, sample, spectrum, cloth, baseline);
                    Path out = writer.write(sample, cube.wavelengths(), result);

                    outputs.add(out);
                    modeCounts.merge(result.effectiveMode().name(), 1, Integer::sum);
                    runLog.ok(sample, result, out);
                    if (result.degraded()) {
                        degraded++;
                        console.println("[OK] " + sample.path() + " (mode: " + result.effectiveMode()
                            + ", degraded from " + resolution.effectiveMode() + ")");
                    } else {
                        console.println("[OK] " + sample.path() + " (mode: " + result.effectiveMode() + ")");
                    }
                    logger.info("OK {} sensor={} timepoint={} ref={} mode={} out={}", sample.path(), sample.sensor(),
                        sample.timepoint(), result.referenceId(), result.effectiveMode(), out);
                } catch (BaselineMismatchException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    failed++;
                    String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    runLog.error(sample, reason);
                    console.println("[ERR] " + sample.path() + ": " + reason);
                    logger.error("ERR {}: {}", sample.path(), reason, e);
                }
            }
        } catch (BaselineMismatchException e) {
            logger.error("Aborting export: {}", e.getMessage());
            // the logs still describe the samples handled before the abort
            try {
                recordRun(config, runLog, outputs.size(), failed, degraded, modeCounts, "baseline_mismatch_" + e.getSensor().name());
            } catch (IOException io) {
                e.addSuppressed(io);
            }
            throw e;
        }
        recordRun(config, runLog, outputs.size(), failed, degraded, modeCounts, null);

        console.println("[DONE] spectra -> " + config.outDir() + ", files: " + outputs.size());
        return new ExportSummary(outputs.size(), failed, degraded, modeCounts, outputs);
    }

    /**
     * Rewrites the run log with the samples handled so far and appends the run's trace line.
     * @param aborted Abort reason, or null for a completed run
     */
    private void recordRun(PipelineConfig config, RunLog runLog, int written, int failed, int degraded,
                           Map<String, Integer> modeCounts, String aborted) throws IOException {
        runLog.write(config.runLogPath());
        Map<String, String> trace = new LinkedHashMap<>();
        trace.put("written", Integer.toString(written));
        trace.put("failed", Integer.toString(failed));
        trace.put("degraded", Integer.toString(degraded));
        trace.put("mode", config.normMode().name());
        trace.put("modes", Utils.formatCounts(modeCounts));
        trace.put("src", config.metadataPath().toString());
        if (aborted != null) trace.put("aborted", aborted);
        new TraceLog(config.traceLogPath()).append("export_spectra", trace);
    }

    /**
     * Mean spectrum of a cloth reference, loaded once per run. Returns null when the reference cannot be loaded,
     * which makes the normalizer record NONE for the sample.
     */
    private double[] referenceSpectrum(String path, Map<String, double[]> cache) {
        if (cache.containsKey(path)) return cache.get(path);
        double[] spectrum = null;
        try {
            spectrum = SpectralMath.reduce(loader.load(path));
        } catch (IOException | RuntimeException e) {
            logger.warn("Cloth reference {} could not be loaded: {}", path, e.getMessage());
        }
        cache.put(path, spectrum);
        return spectrum;
    }
}
