package com.smartagriculture.spectra;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the flat metadata table (one row per captured cube) into {@link SampleRecord}s using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>The path column is {@code hdr_path}, or {@code bil_path} when no header path column exists.</li>
 *   <li>{@code is_ref} accepts 0/1 as well as true/false.</li>
 *   <li>Row order is preserved; rows with a blank path are skipped with a warning.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class MetadataTableReader {
    private static final Logger logger = LoggerFactory.getLogger(MetadataTableReader.class);

    /**
     * Reads all sample records from a metadata table.
     * @param metadataCsv Path of the table
     * @return Records in table order
     * @throws NoSuchFileException if the table does not exist
     * @throws IOException if the table cannot be parsed or lacks required columns
     */
    public List<SampleRecord> read(Path metadataCsv) throws IOException {
        if (!Files.exists(metadataCsv)) {
            throw new NoSuchFileException(metadataCsv.toString(), null, "Missing metadata table; run the inventory step first");
        }
        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(metadataCsv, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in).withCSVParser(new RFC4180ParserBuilder().build()).build()) {
            rows = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Malformed metadata table " + metadataCsv + ": " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            logger.warn("Metadata table {} is empty", metadataCsv);
            return List.of();
        }

        String[] header = rows.get(0);
        List<String> headerList = Arrays.stream(header).map(String::trim).toList();
        // file_name is optional here; the self-check insists on it
        List<String> missing = TableSchemas.missingColumns(TableSchemas.metadataColumns().subList(0, 4), headerList);
        if (!missing.isEmpty()) {
            throw new IOException("Metadata table " + metadataCsv + " missing required columns: " + String.join(", ", missing));
        }

        Map<String, Integer> index = TableSchemas.indexOf(header);
        int pathCol = index.get(TableSchemas.metadataPathColumn().findIn(headerList));
        int sensorCol = index.get(TableSchemas.SENSOR);
        int refCol = index.get(TableSchemas.IS_REF);
        int tpCol = index.get(TableSchemas.TIMEPOINT);
        Integer nameCol = index.get(TableSchemas.FILE_NAME);

        List<SampleRecord> records = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            String path = cell(row, pathCol);
            if (path.isEmpty()) {
                if (row.length > 1 || (row.length == 1 && !row[0].isBlank())) {
                    logger.warn("Skipping metadata row {} with empty path", i + 1);
                }
                continue;
            }
            String fileName = nameCol == null ? "" : cell(row, nameCol);
            if (fileName.isEmpty()) fileName = Path.of(path).getFileName().toString();
            records.add(new SampleRecord(
                path,
                Sensor.fromLabel(cell(row, sensorCol)),
                parseFlag(cell(row, refCol)),
                cell(row, tpCol),
                fileName
            ));
        }
        logger.info("Read {} metadata records from {}", records.size(), metadataCsv);
        return records;
    }

    /**
     * Parses an {@code is_ref} cell.
     * @param value "1", "0", "true", "false" (any case), or "1.0"
     */
    public static boolean parseFlag(String value) {
        if (value == null) return false;
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("1.0") || v.equals("true") || v.equals("yes");
    }

    private static String cell(String[] row, int col) {
        return col < row.length && row[col] != null ? row[col].trim() : "";
    }
}
