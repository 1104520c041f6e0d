package com.smartagriculture.spectra.envi;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parsed ENVI {@code .hdr} file: lower-cased keys mapped to raw values.
 * Brace-delimited values may span lines and are stored without their braces.
 */
public final class EnviHeader {
    private final Map<String, String> fields;

    private EnviHeader(Map<String, String> fields) {
        this.fields = fields;
    }

    public static EnviHeader read(Path hdr) throws IOException {
        return parse(Files.readString(hdr, StandardCharsets.ISO_8859_1));
    }

    public static EnviHeader parse(String text) throws CubeFormatException {
        Map<String, String> fields = new LinkedHashMap<>();
        String[] lines = text.split("\\r?\\n");
        int i = 0;
        if (lines.length > 0 && lines[0].trim().equalsIgnoreCase("ENVI")) i++;
        for (; i < lines.length; i++) {
            String line = lines[i];
            int eq = line.indexOf('=');
            if (eq < 0) continue;
            String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(eq + 1).trim();
            if (value.startsWith("{")) {
                StringBuilder sb = new StringBuilder(value);
                while (sb.indexOf("}") < 0) {
                    if (++i >= lines.length) {
                        throw new CubeFormatException("Unterminated value for header field '" + key + "'");
                    }
                    sb.append(' ').append(lines[i].trim());
                }
                value = sb.substring(1, sb.indexOf("}")).trim();
            }
            fields.put(key, value);
        }
        return new EnviHeader(fields);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(fields.get(key.toLowerCase(Locale.ROOT)));
    }

    /**
     * Reads a mandatory integer field.
     * @throws CubeFormatException if the field is absent or not an integer
     */
    public int requireInt(String key) throws CubeFormatException {
        String v = fields.get(key);
        if (v == null) throw new CubeFormatException("Header is missing required field '" + key + "'");
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new CubeFormatException("Header field '" + key + "' is not an integer: " + v, e);
        }
    }

    public int intOrDefault(String key, int fallback) throws CubeFormatException {
        return fields.containsKey(key) ? requireInt(key) : fallback;
    }

    /**
     * Splits a brace list into trimmed items; empty when the field is absent.
     */
    public List<String> list(String key) {
        String v = fields.get(key);
        if (v == null || v.isBlank()) return List.of();
        List<String> items = new ArrayList<>();
        for (String item : v.split(",")) {
            if (!item.isBlank()) items.add(item.trim());
        }
        return items;
    }
}
