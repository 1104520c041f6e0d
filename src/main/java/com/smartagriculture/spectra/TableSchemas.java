package com.smartagriculture.spectra;

import java.util.*;

/**
 * Central registry for the columns of every table the pipeline reads or writes.
 * Producers (writers) and the auditor ({@link SelfCheckValidator}) both use these lists so
 * that a renamed column cannot drift between them.
 */
public final class TableSchemas {
    private TableSchemas() {}

    public static final String HDR_PATH = "hdr_path";
    public static final String BIL_PATH = "bil_path";
    public static final String SENSOR = "sensor";
    public static final String IS_REF = "is_ref";
    public static final String TIMEPOINT = "timepoint";
    public static final String FILE_NAME = "file_name";

    public static final String BAND_IDX = "band_idx";
    public static final String WAVELENGTH_NM = "wavelength_nm";
    public static final String REFL_NORM = "refl_norm";
    public static final String REFL_MEAN = "refl_mean";
    public static final String REF_FILE = "ref_file";
    public static final String NORM_MODE_USED = "norm_mode_used";

    /** Leading comment line of every spectrum file; the mode follows the colon. */
    public static final String MODE_ANNOTATION_PREFIX = "# Normalization mode used:";
    /** Leading comment line of every baseline file. */
    public static final String BASELINE_KEY_PREFIX = "# baseline_key:";

    public static final String SPECTRUM_FILE_SUFFIX = "_spectrum.csv";
    public static final String METADATA_FILE = "hsi_meta.csv";

    // Input metadata table; the path column may be either of its names
    private static final List<TableColumn> METADATA = List.of(
        new TableColumn(HDR_PATH, List.of(BIL_PATH)),
        new TableColumn(SENSOR, List.of()),
        new TableColumn(IS_REF, List.of()),
        new TableColumn(TIMEPOINT, List.of()),
        new TableColumn(FILE_NAME, List.of())
    );

    private static final List<TableColumn> SPECTRUM = List.of(
        new TableColumn(BAND_IDX, List.of()),
        new TableColumn(WAVELENGTH_NM, List.of()),
        new TableColumn(REFL_NORM, List.of()),
        new TableColumn(SENSOR, List.of()),
        new TableColumn(TIMEPOINT, List.of()),
        new TableColumn(REF_FILE, List.of()),
        new TableColumn(NORM_MODE_USED, List.of())
    );

    private static final List<TableColumn> BASELINE = List.of(
        new TableColumn(BAND_IDX, List.of()),
        new TableColumn(WAVELENGTH_NM, List.of()),
        new TableColumn(REFL_MEAN, List.of())
    );

    private static final List<TableColumn> RUN_LOG = List.of(
        new TableColumn("status", List.of()),
        new TableColumn("file", List.of()),
        new TableColumn(SENSOR, List.of()),
        new TableColumn(TIMEPOINT, List.of()),
        new TableColumn("ref_file_used", List.of()),
        new TableColumn(NORM_MODE_USED, List.of()),
        new TableColumn("out_path", List.of())
    );

    public static List<TableColumn> metadataColumns() {
        return METADATA;
    }

    public static TableColumn metadataPathColumn() {
        return METADATA.get(0);
    }

    public static List<TableColumn> spectrumColumns() {
        return SPECTRUM;
    }

    public static List<TableColumn> baselineColumns() {
        return BASELINE;
    }

    public static List<TableColumn> runLogColumns() {
        return RUN_LOG;
    }

    /**
     * Returns the canonical names of the given columns, in order, for use as a header row.
     */
    public static String[] header(List<TableColumn> columns) {
        return columns.stream().map(c -> c.columnName).toArray(String[]::new);
    }

    /**
     * Returns the display names of the columns missing from a header row.
     * @param columns Required columns
     * @param header Header cells actually present
     * @return Missing column names, empty when the header is complete
     */
    public static List<String> missingColumns(List<TableColumn> columns, List<String> header) {
        List<String> missing = new ArrayList<>();
        for (TableColumn c : columns) {
            if (c.findIn(header) == null) missing.add(c.displayName());
        }
        return missing;
    }

    /**
     * Builds a column-name to index lookup for a header row.
     */
    public static Map<String, Integer> indexOf(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            index.putIfAbsent(header[i].trim(), i);
        }
        return index;
    }
}
