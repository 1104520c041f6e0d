package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Computes, persists and reloads the per-sensor healthy baseline spectrum.
 * <p>
 * Workflow:
 * <ul>
 *   <li>A baseline is the band-wise NaN-aware mean of every non-reference sample of the sensor taken at the configured baseline timepoint.</li>
 *   <li>Each sensor is resolved at most once per instance; the result, including absence, is memoized.</li>
 *   <li>An existing {@code baseline_<SENSOR>.csv} short-circuits recomputation. Deleting the file is the way to force a rebuild.</li>
 *   <li>With {@link PipelineConfig#baselineIntegrityCheck()} enabled, a file whose recorded sources digest differs from the current contributors is rebuilt.</li>
 *   <li>Contributors that fail to load are logged and left out; if none loads the baseline is absent and nothing is written.</li>
 * </ul>
 * Absence is never represented as a zero vector.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class BaselineCache implements BaselineCacheInterface {
    private static final Logger logger = LoggerFactory.getLogger(BaselineCache.class);

    private final PipelineConfig config;
    private final CubeLoaderInterface loader;
    private final Map<Sensor, Optional<BaselineSpectrum>> memo = new EnumMap<>(Sensor.class);

    public BaselineCache(PipelineConfig config, CubeLoaderInterface loader) {
        this.config = Objects.requireNonNull(config, "config");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public Path baselineFile(Sensor sensor) {
        return config.outDir().resolve("baseline_" + sensor.name() + ".csv");
    }

    @Override
    public Map<Sensor, Boolean> precompute(Collection<Sensor> sensors, List<SampleRecord> metadata) {
        Map<Sensor, Boolean> available = new EnumMap<>(Sensor.class);
        for (Sensor sensor : sensors) {
            available.put(sensor, getBaseline(sensor, metadata, null).isPresent());
        }
        logger.info("Baseline availability: {}", available);
        return available;
    }

    @Override
    public Optional<double[]> getBaseline(Sensor sensor, List<SampleRecord> metadata, double[] wavelengths) {
        Optional<BaselineSpectrum> baseline = memo.computeIfAbsent(sensor, s -> resolve(s, metadata));
        if (baseline.isPresent() && wavelengths != null && baseline.get().bandCount() != wavelengths.length) {
            throw new BaselineMismatchException(sensor, baselineFile(sensor), baseline.get().bandCount(), wavelengths.length);
        }
        return baseline.map(BaselineSpectrum::values);
    }

    /**
     * Baseline-timepoint, non-reference samples of a sensor, in table order.
     */
    public List<SampleRecord> contributors(Sensor sensor, List<SampleRecord> metadata) {
        List<SampleRecord> out = new ArrayList<>();
        for (SampleRecord r : metadata) {
            if (r.sensor() == sensor && !r.isReference() && config.isBaselineTimepoint(r.timepoint())) {
                out.add(r);
            }
        }
        return out;
    }

    private Optional<BaselineSpectrum> resolve(Sensor sensor, List<SampleRecord> metadata) {
        List<SampleRecord> selected = contributors(sensor, metadata);
        BaselineKey currentKey = BaselineKey.of(sensor, selected.stream().map(SampleRecord::path).toList());
        Path file = baselineFile(sensor);

        if (Files.exists(file)) {
            try {
                BaselineSpectrum stored = readBaseline(file, sensor);
                if (!config.baselineIntegrityCheck()) {
                    logger.info("Loaded cached baseline for {} from {}", sensor, file);
                    return Optional.of(stored);
                }
                if (currentKey.equals(stored.key())) {
                    logger.info("Loaded cached baseline for {} from {} (sources digest verified)", sensor, file);
                    return Optional.of(stored);
                }
                logger.warn("Cached baseline {} was built from different samples than the current table; rebuilding", file);
            } catch (IOException | RuntimeException e) {
                logger.error("Cached baseline {} is unreadable: {}. Treating {} baseline as absent; delete the file to rebuild it.",
                    file, e.getMessage(), sensor);
                return Optional.empty();
            }
        }

        if (selected.isEmpty()) {
            logger.warn("No non-reference {} samples at baseline timepoint '{}'; {} baseline is absent",
                sensor, config.baselineTimepoint(), sensor);
            return Optional.empty();
        }

        List<double[]> spectra = new ArrayList<>();
        List<String> used = new ArrayList<>();
        double[] wavelengths = null;
        for (SampleRecord r : selected) {
            try {
                HyperspectralCube cube = loader.load(r.path());
                double[] spectrum = SpectralMath.reduce(cube);
                if (wavelengths != null && spectrum.length != wavelengths.length) {
                    logger.warn("Excluding {} from {} baseline: {} bands, expected {}", r.path(), sensor, spectrum.length, wavelengths.length);
                    continue;
                }
                if (wavelengths == null) wavelengths = cube.wavelengths();
                spectra.add(spectrum);
                used.add(r.path());
            } catch (IOException | RuntimeException e) {
                logger.warn("Excluding {} from {} baseline: {}", r.path(), sensor, e.getMessage());
            }
        }
        if (spectra.isEmpty()) {
            logger.warn("None of the {} baseline samples for {} could be loaded; baseline is absent", selected.size(), sensor);
            return Optional.empty();
        }

        BaselineSpectrum computed = new BaselineSpectrum(currentKey, wavelengths, SpectralMath.nanMeanOf(spectra));
        try {
            writeBaseline(file, computed);
            logger.info("Built {} baseline from {} of {} samples -> {}", sensor, used.size(), selected.size(), file);
        } catch (IOException e) {
            logger.error("Failed to persist {} baseline to {}: {}", sensor, file, e.getMessage());
        }
        return Optional.of(computed);
    }

    static void writeBaseline(Path file, BaselineSpectrum baseline) throws IOException {
        List<String[]> rows = new ArrayList<>(baseline.bandCount());
        for (int b = 0; b < baseline.bandCount(); b++) {
            rows.add(new String[]{
                Integer.toString(b),
                Double.toString(baseline.wavelengths()[b]),
                Double.toString(baseline.values()[b])
            });
        }
        Utils.writeCsvAtomically(file, List.of(baseline.key().toAnnotation()),
            TableSchemas.header(TableSchemas.baselineColumns()), rows);
    }

    static BaselineSpectrum readBaseline(Path file, Sensor sensor) throws IOException {
        AnnotatedTable table = AnnotatedTable.read(file);
        List<String> missing = TableSchemas.missingColumns(TableSchemas.baselineColumns(), table.header());
        if (!missing.isEmpty()) {
            throw new IOException("missing columns " + String.join(", ", missing));
        }
        BaselineKey key = table.comments().stream()
            .map(BaselineKey::parseAnnotation)
            .flatMap(Optional::stream)
            .findFirst()
            .orElse(new BaselineKey(sensor, null));
        List<String> wl = table.column(TableSchemas.WAVELENGTH_NM);
        List<String> refl = table.column(TableSchemas.REFL_MEAN);
        double[] wavelengths = new double[wl.size()];
        double[] values = new double[refl.size()];
        for (int i = 0; i < values.length; i++) {
            wavelengths[i] = Double.parseDouble(wl.get(i));
            values[i] = Double.parseDouble(refl.get(i));
        }
        return new BaselineSpectrum(key, wavelengths, values);
    }
}
