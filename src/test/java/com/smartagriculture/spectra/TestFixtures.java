package com.smartagriculture.spectra;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for pipeline tests: an in-memory cube loader and metadata table writer.
 */
final class TestFixtures {
    private TestFixtures() {}

    /**
     * Cube loader backed by a map; unknown paths fail like a missing file.
     */
    static final class FakeCubeLoader implements CubeLoaderInterface {
        private final Map<String, HyperspectralCube> cubes = new HashMap<>();
        private final Map<String, Integer> loads = new HashMap<>();

        FakeCubeLoader put(String path, HyperspectralCube cube) {
            cubes.put(path, cube);
            return this;
        }

        int loadCount(String path) {
            return loads.getOrDefault(path, 0);
        }

        @Override
        public HyperspectralCube load(String path) throws IOException {
            loads.merge(path, 1, Integer::sum);
            HyperspectralCube cube = cubes.get(path);
            if (cube == null) throw new NoSuchFileException(path);
            return cube;
        }
    }

    /**
     * 2x2 cube whose every pixel carries the given spectrum; wavelengths 400, 410, ...
     */
    static HyperspectralCube uniformCube(double... spectrum) {
        double[][][] values = new double[2][2][];
        for (int l = 0; l < 2; l++) {
            for (int s = 0; s < 2; s++) values[l][s] = spectrum.clone();
        }
        return new HyperspectralCube(values, wavelengths(spectrum.length));
    }

    static double[] wavelengths(int bands) {
        double[] wl = new double[bands];
        for (int i = 0; i < bands; i++) wl[i] = 400.0 + 10.0 * i;
        return wl;
    }

    static SampleRecord sample(String path, Sensor sensor, String timepoint) {
        return new SampleRecord(path, sensor, false, timepoint, path + ".hdr");
    }

    static SampleRecord cloth(String path, Sensor sensor, String timepoint) {
        return new SampleRecord(path, sensor, true, timepoint, path + ".hdr");
    }

    static void writeMetadata(Path file, List<SampleRecord> records) throws IOException {
        Files.createDirectories(file.getParent());
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(w)) {
            writer.writeNext(new String[]{
                TableSchemas.HDR_PATH, TableSchemas.SENSOR, TableSchemas.IS_REF, TableSchemas.TIMEPOINT, TableSchemas.FILE_NAME
            }, false);
            for (SampleRecord r : records) {
                writer.writeNext(new String[]{
                    r.path(), r.sensor().name(), r.isReference() ? "1" : "0", r.timepoint(), r.fileName()
                }, false);
            }
        }
    }

    static PipelineConfig config(Path root, NormalizationMode mode) {
        return PipelineConfig.defaults().withRoot(root).withNormMode(mode);
    }
}
