package com.smartagriculture.spectra;

import java.util.List;

/**
 * Represents a column of one of the CSV tables the pipeline reads or writes.
 * Contains the canonical column name and any accepted alternative names.
 * A column with alternatives is satisfied by any one of its names being present.
 */
public class TableColumn {
    public final String columnName;
    public final List<String> alternatives;

    public TableColumn(String columnName, List<String> alternatives) {
        this.columnName = columnName;
        this.alternatives = alternatives;
    }

    /**
     * Returns the first of this column's names found in a header row, or null when none is present.
     * @param header Header cells
     */
    public String findIn(List<String> header) {
        if (header.contains(columnName)) return columnName;
        for (String alt : alternatives) {
            if (header.contains(alt)) return alt;
        }
        return null;
    }

    /**
     * Human readable name, e.g. {@code hdr_path|bil_path}.
     */
    public String displayName() {
        if (alternatives.isEmpty()) return columnName;
        return columnName + "|" + String.join("|", alternatives);
    }
}
