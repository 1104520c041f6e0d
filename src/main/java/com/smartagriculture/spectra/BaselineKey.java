package com.smartagriculture.spectra;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Identity of a persisted baseline: the sensor plus a SHA-256 digest of the sorted contributing cube paths.
 * Recorded in the first line of every baseline file so an optional integrity check can detect that the
 * contributing samples have changed since the file was written.
 *
 * @param sensor Sensor the baseline belongs to
 * @param sourcesDigest Hex SHA-256 of the contributing paths, sorted and newline-joined
 */
public record BaselineKey(Sensor sensor, String sourcesDigest) {

    public static BaselineKey of(Sensor sensor, List<String> contributingPaths) {
        String joined = String.join("\n", contributingPaths.stream().sorted().toList());
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(joined.getBytes(StandardCharsets.UTF_8));
            return new BaselineKey(sensor, HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * @return Comment line for the baseline file, e.g. {@code # baseline_key: sensor=SWIR;sources_sha256=ab12...}
     */
    public String toAnnotation() {
        return TableSchemas.BASELINE_KEY_PREFIX + " sensor=" + sensor.name() + ";sources_sha256=" + sourcesDigest;
    }

    /**
     * Parses a comment line written by {@link #toAnnotation()}.
     * @return The key, or empty when the line is not a baseline key annotation
     */
    public static Optional<BaselineKey> parseAnnotation(String line) {
        if (line == null || !line.startsWith(TableSchemas.BASELINE_KEY_PREFIX)) return Optional.empty();
        Sensor sensor = null;
        String digest = null;
        for (String part : line.substring(TableSchemas.BASELINE_KEY_PREFIX.length()).trim().split(";")) {
            int eq = part.indexOf('=');
            if (eq < 0) continue;
            String k = part.substring(0, eq).trim();
            String v = part.substring(eq + 1).trim();
            if (k.equals("sensor")) sensor = Sensor.fromLabel(v);
            else if (k.equals("sources_sha256")) digest = v;
        }
        if (sensor == null || digest == null) return Optional.empty();
        return Optional.of(new BaselineKey(sensor, digest));
    }
}
