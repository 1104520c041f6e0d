package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which normalization strategy applies to a sample.
 * <p>
 * Workflow:
 * <ul>
 *   <li>An explicit configured mode always wins, even when its prerequisites are missing; {@link Normalizer} records the downgrade.</li>
 *   <li>AUTO tries, in order: a cloth reference at the same sensor and timepoint, any cloth reference of the same sensor,
 *       the sensor's baseline, and finally ZSCORE.</li>
 *   <li>Cloth candidates are taken in metadata table order and the first match wins, so resolution is deterministic for a given table.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class ModeResolver {
    private static final Logger logger = LoggerFactory.getLogger(ModeResolver.class);

    /**
     * Resolves the effective mode for one sample.
     * @param config Pipeline configuration carrying the configured mode
     * @param sample Sample being normalized
     * @param metadata Full metadata table
     * @param baselineAvailable Per-sensor baseline availability; a missing entry means unavailable
     * @return Resolution whose effective mode is never AUTO
     */
    public ModeResolution resolve(PipelineConfig config, SampleRecord sample, List<SampleRecord> metadata,
                                  Map<Sensor, Boolean> baselineAvailable) {
        NormalizationMode requested = config.normMode();
        String cloth = findClothReference(sample, metadata).map(SampleRecord::path).orElse(null);

        NormalizationMode effective;
        if (requested != NormalizationMode.AUTO) {
            effective = requested;
        } else if (cloth != null) {
            effective = NormalizationMode.CLOTH;
        } else if (Boolean.TRUE.equals(baselineAvailable.get(sample.sensor()))) {
            effective = NormalizationMode.BASELINE;
        } else {
            effective = NormalizationMode.ZSCORE;
        }
        logger.debug("Resolved {} -> {} for {} (cloth={})", requested, effective, sample.path(), cloth);
        return new ModeResolution(requested, effective, cloth);
    }

    /**
     * Finds the cloth reference for a sample: same sensor and timepoint first, then any timepoint of the same sensor.
     * @param sample Sample being normalized
     * @param metadata Full metadata table, in table order
     * @return First matching reference row, or empty when the sensor has no cloth capture
     */
    public Optional<SampleRecord> findClothReference(SampleRecord sample, List<SampleRecord> metadata) {
        SampleRecord anyTimepoint = null;
        for (SampleRecord r : metadata) {
            if (!r.isReference() || r.sensor() != sample.sensor()) continue;
            if (r.timepoint().equals(sample.timepoint())) return Optional.of(r);
            if (anyTimepoint == null) anyTimepoint = r;
        }
        return Optional.ofNullable(anyTimepoint);
    }
}
