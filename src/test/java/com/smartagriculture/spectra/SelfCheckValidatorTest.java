package com.smartagriculture.spectra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.smartagriculture.spectra.TestFixtures.cloth;
import static com.smartagriculture.spectra.TestFixtures.sample;
import static org.junit.jupiter.api.Assertions.*;

public class SelfCheckValidatorTest {
    @TempDir
    Path root;

    private PipelineConfig config;
    private final ByteArrayOutputStream consoleBytes = new ByteArrayOutputStream();
    private SelfCheckValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        config = TestFixtures.config(root, NormalizationMode.AUTO);
        validator = new SelfCheckValidator(new PrintStream(consoleBytes, true, StandardCharsets.UTF_8));
        TestFixtures.writeMetadata(config.metadataPath(), List.of(
            cloth("cloth_v", Sensor.VISNIR, "D0"),
            sample("a", Sensor.VISNIR, "D0"),
            sample("b", Sensor.VISNIR, "D3"),
            sample("c", Sensor.SWIR, "D3")));
    }

    private void writeSpectrum(String stem, String annotatedMode, String rowMode, Sensor sensor, String... values) throws Exception {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            rows.add(new String[]{Integer.toString(i), Double.toString(400.0 + i), values[i], sensor.name(), "D3", "ref", rowMode});
        }
        Utils.writeCsvAtomically(config.outDir().resolve(stem + TableSchemas.SPECTRUM_FILE_SUFFIX),
            List.of(TableSchemas.MODE_ANNOTATION_PREFIX + " " + annotatedMode),
            TableSchemas.header(TableSchemas.spectrumColumns()), rows);
    }

    private void writeValidOutputs() throws Exception {
        writeSpectrum("a", "CLOTH", "CLOTH", Sensor.VISNIR, "0.5", "1.0");
        writeSpectrum("b", "CLOTH", "CLOTH", Sensor.VISNIR, "1.5", "2.0");
        writeSpectrum("c", "ZSCORE", "ZSCORE", Sensor.SWIR, "0.0", "1.0");
    }

    @Test
    void testPassWritesReportJsonAndTrace() throws Exception {
        writeValidOutputs();
        SelfCheckReport report = validator.run(config);

        assertTrue(report.passed(), report::error);
        assertEquals(0, report.exitCode());
        assertEquals(4, report.metaRows());
        assertEquals(3, report.spectraFiles());
        assertEquals(6, report.totalRows());
        assertEquals(2, report.modeCounts().get("CLOTH"));
        assertEquals(1.25, report.perSensorMean().get("VISNIR"), 1e-12);
        assertEquals(2, report.sensorCounts().get("VISNIR"));
        assertTrue(report.warnings().get(0).startsWith("33% of files used ZSCORE"));

        String console = consoleBytes.toString(StandardCharsets.UTF_8);
        assertTrue(console.contains("SELF-CHECK REPORT"));
        assertTrue(console.contains("status=PASS"));
        assertTrue(console.contains("per_sensor_mean={'SWIR': 0.5000, 'VISNIR': 1.2500}"));

        JsonNode json = new ObjectMapper().readTree(config.selfCheckReportPath().toFile());
        assertEquals("PASS", json.get("status").asText());
        assertEquals(3, json.get("spectraFiles").asInt());
        assertTrue(Files.readString(config.traceLogPath()).contains(",self_check,status=PASS,meta_rows=4,spectra_count=3"));
    }

    @Test
    void testMissingMetadataFailsAtLoad() throws Exception {
        Files.delete(config.metadataPath());
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.LOAD_METADATA, report.failedStage());
        assertEquals(1, report.exitCode());
        assertTrue(Files.exists(config.selfCheckReportPath()));
    }

    @Test
    void testMetadataNeedsBothSensors() throws Exception {
        TestFixtures.writeMetadata(config.metadataPath(), List.of(sample("a", Sensor.VISNIR, "D0")));
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_METADATA, report.failedStage());
        assertTrue(report.error().contains("VISNIR and SWIR"));
    }

    @Test
    void testMetadataMissingColumn() throws Exception {
        Files.writeString(config.metadataPath(), "hdr_path,sensor,is_ref\na,VISNIR,0\n");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_METADATA, report.failedStage());
        assertTrue(report.error().contains("timepoint"));
    }

    @Test
    void testTooFewSpectrumFiles() throws Exception {
        writeSpectrum("a", "CLOTH", "CLOTH", Sensor.VISNIR, "0.5");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
        assertTrue(report.error().startsWith("Found 1 "));
    }

    @Test
    void testAnnotationDisagreeingWithRowsFails() throws Exception {
        writeValidOutputs();
        writeSpectrum("b", "ZSCORE", "CLOTH", Sensor.VISNIR, "0.5");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
        assertTrue(report.error().contains("Inconsistent norm_mode_used in b_spectrum.csv"));
    }

    @Test
    void testMixedRowModesFailEvenWhenHeaderModeIsPresent() throws Exception {
        writeValidOutputs();
        Path file = config.outDir().resolve("b_spectrum.csv");
        List<String> lines = new ArrayList<>(Files.readAllLines(file));
        lines.set(3, lines.get(3).replace(",CLOTH", ",ZSCORE"));
        Files.write(file, lines);

        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
        assertTrue(report.error().contains("Inconsistent norm_mode_used in b_spectrum.csv"));
        assertTrue(report.error().contains("Header: CLOTH, Column: [CLOTH, ZSCORE]"));
    }

    @Test
    void testMissingAnnotationReadsAsUnknown() throws Exception {
        writeValidOutputs();
        Path file = config.outDir().resolve("c_spectrum.csv");
        List<String> lines = Files.readAllLines(file);
        Files.write(file, lines.subList(1, lines.size()));
        SelfCheckReport report = validator.run(config);
        assertFalse(report.passed());
        assertTrue(report.error().contains("Header: UNKNOWN"));
    }

    @Test
    void testClothValueAboveCeilingFails() throws Exception {
        writeValidOutputs();
        writeSpectrum("b", "CLOTH", "CLOTH", Sensor.VISNIR, "2.5");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
        assertTrue(report.error().contains("outside [0.0, 2.0]"));
    }

    @Test
    void testZscoreOutsideUnitRangeFails() throws Exception {
        writeValidOutputs();
        writeSpectrum("c", "ZSCORE", "ZSCORE", Sensor.SWIR, "1.2");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
    }

    @Test
    void testNanFails() throws Exception {
        writeValidOutputs();
        writeSpectrum("c", "NONE", "NONE", Sensor.SWIR, "NaN");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
        assertTrue(report.error().contains("NaN or Inf"));
    }

    @Test
    void testNoneIsNotRangeChecked() throws Exception {
        writeValidOutputs();
        writeSpectrum("c", "NONE", "NONE", Sensor.SWIR, "37.5");
        assertTrue(validator.run(config).passed());
    }

    @Test
    void testAutoIsNeverAValidRecordedMode() throws Exception {
        writeValidOutputs();
        writeSpectrum("c", "AUTO", "AUTO", Sensor.SWIR, "0.5");
        SelfCheckReport report = validator.run(config);
        assertEquals(SelfCheckStage.VALIDATE_OUTPUTS, report.failedStage());
    }

    @Test
    void testConfiguredBaselineNeedsBaselineFile() throws Exception {
        writeSpectrum("a", "BASELINE", "BASELINE", Sensor.VISNIR, "1.0");
        writeSpectrum("b", "BASELINE", "BASELINE", Sensor.VISNIR, "1.0");
        writeSpectrum("c", "BASELINE", "BASELINE", Sensor.SWIR, "1.0");
        PipelineConfig baseline = config.withNormMode(NormalizationMode.BASELINE);

        SelfCheckReport report = validator.run(baseline);
        assertEquals(SelfCheckStage.POLICY_CHECK, report.failedStage());

        Files.writeString(config.outDir().resolve("baseline_VISNIR.csv"), "band_idx,wavelength_nm,refl_mean\n");
        assertTrue(validator.run(baseline).passed());
    }

    @Test
    void testZscoreShareAtThresholdDoesNotWarn() throws Exception {
        writeSpectrum("a", "CLOTH", "CLOTH", Sensor.VISNIR, "1.0");
        writeSpectrum("b", "CLOTH", "CLOTH", Sensor.VISNIR, "1.0");
        writeSpectrum("c", "CLOTH", "CLOTH", Sensor.SWIR, "1.0");
        writeSpectrum("d", "ZSCORE", "ZSCORE", Sensor.SWIR, "0.5");
        SelfCheckReport report = validator.run(config);
        assertTrue(report.passed());
        assertTrue(report.warnings().isEmpty());
    }
}
