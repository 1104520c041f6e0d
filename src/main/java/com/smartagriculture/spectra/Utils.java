package com.smartagriculture.spectra;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Utility class for common helper methods used in file naming, table writing and report formatting.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        // Replace each invalid character or whitespace with a single underscore
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * File name of a path without its last extension, e.g. {@code leaf_D0.hdr -> leaf_D0}.
     * @param path Path string
     * @return Stem of the file name
     */
    public static String fileStem(String path) {
        String name = Path.of(path).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Writes a CSV table all-or-nothing: rows go to a temporary file in the target directory which then
     * replaces the target. A failure leaves any previous target untouched and no partial file behind.
     * @param target Final path
     * @param comments Lines written verbatim before the header (each should start with '#')
     * @param header Header row
     * @param rows Data rows
     * @throws IOException if writing or the final move fails
     */
    public static void writeCsvAtomically(Path target, List<String> comments, String[] header, List<String[]> rows) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVWriter writer = new CSVWriter(w)) {
                for (String comment : comments) {
                    w.write(comment);
                    w.write(CSVWriter.DEFAULT_LINE_END);
                }
                writer.writeNext(header, false);
                for (String[] row : rows) writer.writeNext(row, false);
                writer.flush();
                if (writer.checkError()) {
                    throw new IOException("Failed writing rows to " + tmp);
                }
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}, falling back to plain replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Formats a histogram with sorted keys, e.g. {@code {'CLOTH': 2, 'ZSCORE': 1}}.
     * @param counts Histogram
     * @return Formatted string, {@code {}} when empty
     */
    public static String formatCounts(Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) return "{}";
        return new TreeMap<>(counts).entrySet().stream()
            .map(e -> "'" + e.getKey() + "': " + e.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
