package com.smartagriculture.spectra;

import java.util.Locale;

/**
 * Sensor modality that captured a hyperspectral cube.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public enum Sensor {
    VISNIR,
    SWIR,
    UNKNOWN;

    /**
     * Parses a sensor label from a metadata table cell, case-insensitively.
     * @param value Raw cell value
     * @return Matching sensor, or {@link #UNKNOWN} for blank or unrecognised labels
     */
    public static Sensor fromLabel(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (Sensor s : values()) {
            if (s.name().equals(upper)) return s;
        }
        return UNKNOWN;
    }
}
