package com.smartagriculture.spectra;

import com.opencsv.CSVWriter;
import com.smartagriculture.spectra.envi.EnviCubeLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the metadata table from the raw cube directory using filename conventions.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Walks the data directory for {@code *.hdr} files, sorted by path so the table order is stable.</li>
 *   <li>Derives sensor, cloth flag and timepoint from each file name.</li>
 *   <li>Locates the sibling raster file the way {@link EnviCubeLoader} does.</li>
 *   <li>Writes {@code hsi_meta.csv} into the output directory with OpenCSV.</li>
 * </ul>
 * Re-running on the same directory rewrites an identical table.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class InventoryScanner {
    private static final Logger logger = LoggerFactory.getLogger(InventoryScanner.class);

    private static final Pattern DAY_TIMEPOINT = Pattern.compile("D(\\d+)");

    /**
     * Scans {@code config.dataDir()} and writes the metadata table to {@code config.metadataPath()}.
     * @param config Pipeline configuration
     * @return Records written, in table order
     * @throws NoSuchFileException if the data directory does not exist
     * @throws IOException if the directory cannot be walked or the table cannot be written
     */
    public List<SampleRecord> scan(PipelineConfig config) throws IOException {
        Path dataDir = config.dataDir();
        logger.info("Starting metadata extraction from {}", dataDir);
        if (!Files.isDirectory(dataDir)) {
            throw new NoSuchFileException(dataDir.toString(), null, "Data directory not found");
        }

        List<Path> headers;
        try (Stream<Path> walk = Files.walk(dataDir)) {
            headers = walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".hdr"))
                .sorted()
                .collect(Collectors.toList());
        }
        if (headers.isEmpty()) {
            logger.warn("No .hdr files discovered under {}", dataDir);
        }

        List<SampleRecord> records = new ArrayList<>();
        List<String[]> rows = new ArrayList<>();
        for (Path hdr : headers) {
            String fileName = hdr.getFileName().toString();
            SampleRecord rec = new SampleRecord(
                hdr.toString(),
                sensorOf(fileName),
                isCloth(fileName),
                timepointOf(fileName),
                fileName
            );
            records.add(rec);
            Path raster = EnviCubeLoader.findRaster(hdr);
            rows.add(new String[]{
                rec.path(),
                raster == null ? "" : raster.toString(),
                rec.sensor().name(),
                rec.isReference() ? "1" : "0",
                rec.timepoint(),
                rec.fileName()
            });
        }

        Path out = config.metadataPath();
        Files.createDirectories(out.getParent());
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(w)) {
            writer.writeNext(new String[]{
                TableSchemas.HDR_PATH, TableSchemas.BIL_PATH, TableSchemas.SENSOR,
                TableSchemas.IS_REF, TableSchemas.TIMEPOINT, TableSchemas.FILE_NAME
            }, false);
            for (String[] row : rows) writer.writeNext(row, false);
        }
        logger.info("Generated {} with {} records", out, records.size());
        return records;
    }

    /**
     * Sensor implied by a file name: "visnir" or "vis" means VISNIR, "swir" means SWIR, case-insensitive.
     */
    public static Sensor sensorOf(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.contains("visnir")) return Sensor.VISNIR;
        if (lower.contains("swir")) return Sensor.SWIR;
        if (lower.contains("vis")) return Sensor.VISNIR;
        return Sensor.UNKNOWN;
    }

    public static boolean isCloth(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).contains("cloth");
    }

    /**
     * Timepoint implied by a file name: "2h" if present, else "D&lt;n&gt;" from the first day tag, else "before".
     */
    public static String timepointOf(String fileName) {
        if (fileName.contains("2h")) return "2h";
        Matcher m = DAY_TIMEPOINT.matcher(fileName);
        if (m.find()) return "D" + m.group(1);
        return "before";
    }
}
