package com.smartagriculture.spectra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {
    @TempDir
    Path dir;

    @Test
    void testDefaults() throws Exception {
        PipelineConfig config = PipelineConfig.load(new Properties(), Map.of());
        assertEquals(NormalizationMode.AUTO, config.normMode());
        assertEquals("D0", config.baselineTimepoint());
        assertEquals(Paths.get("data_processed", "hsi_meta.csv"), config.metadataPath());
        assertFalse(config.baselineIntegrityCheck());
    }

    @Test
    void testPropertyTakesPrecedenceOverEnvironment() throws Exception {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.NORM_MODE, "cloth");
        PipelineConfig config = PipelineConfig.load(props,
            Map.of(PipelineConfig.NORM_MODE, "ZSCORE", PipelineConfig.BASELINE_TIMEPOINT, "D1"));
        assertEquals(NormalizationMode.CLOTH, config.normMode());
        assertEquals("D1", config.baselineTimepoint());
    }

    @Test
    void testJsonOverlayThenEnvironment() throws Exception {
        Path json = dir.resolve("pipeline.json");
        Files.writeString(json, "{\"normMode\": \"BASELINE\", \"outDir\": \"out\", \"zscoreWarnRatio\": 0.5}");
        PipelineConfig config = PipelineConfig.load(new Properties(),
            Map.of(PipelineConfig.CONFIG_FILE, json.toString(), PipelineConfig.OUT_DIR, "override"));
        assertEquals(NormalizationMode.BASELINE, config.normMode());
        assertEquals(Paths.get("override"), config.outDir());
        assertEquals(0.5, config.zscoreWarnRatio(), 0.0);
    }

    @Test
    void testNoneIsNotConfigurable() {
        assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.load(new Properties(), Map.of(PipelineConfig.NORM_MODE, "NONE")));
        assertThrows(IllegalArgumentException.class, () -> NormalizationMode.parseConfigured("bogus"));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.defaults().withNormMode(NormalizationMode.NONE));
    }

    @Test
    void testMissingJsonFileFails() {
        assertThrows(java.io.IOException.class, () -> PipelineConfig.load(new Properties(),
            Map.of(PipelineConfig.CONFIG_FILE, dir.resolve("absent.json").toString())));
    }
}
