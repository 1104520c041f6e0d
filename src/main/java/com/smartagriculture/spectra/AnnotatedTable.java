package com.smartagriculture.spectra;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * A CSV table preceded by optional {@code #} comment lines, as written by {@link Utils#writeCsvAtomically}.
 *
 * @param comments Leading comment lines, verbatim
 * @param header Header cells, trimmed
 * @param rows Data rows (blank lines dropped)
 */
public record AnnotatedTable(List<String> comments, List<String> header, List<String[]> rows) {

    /**
     * Reads a table, splitting off leading comment lines before handing the rest to OpenCSV.
     * @param file Table path
     * @throws IOException if the file cannot be read or parsed
     */
    public static AnnotatedTable read(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> comments = new ArrayList<>();
        int i = 0;
        while (i < lines.size() && lines.get(i).startsWith("#")) {
            comments.add(lines.get(i));
            i++;
        }
        String body = String.join("\n", lines.subList(i, lines.size()));
        List<String[]> all;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(body))
                .withCSVParser(new RFC4180ParserBuilder().build()).build()) {
            all = new ArrayList<>(reader.readAll());
        } catch (CsvException e) {
            throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        }
        all.removeIf(r -> r.length == 0 || (r.length == 1 && r[0].isBlank()));
        if (all.isEmpty()) {
            return new AnnotatedTable(comments, List.of(), List.of());
        }
        List<String> header = Arrays.stream(all.get(0)).map(String::trim).toList();
        return new AnnotatedTable(comments, header, all.subList(1, all.size()));
    }

    /**
     * Values of one column in row order; missing cells read as empty strings.
     * @param column Column name
     * @throws IllegalArgumentException if the column is not in the header
     */
    public List<String> column(String column) {
        int idx = header.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("No column '" + column + "'");
        List<String> values = new ArrayList<>(rows.size());
        for (String[] r : rows) values.add(idx < r.length ? r[idx].trim() : "");
        return values;
    }
}
