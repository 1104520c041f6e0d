package com.smartagriculture.spectra;

/**
 * Immutable record representing one captured cube listed in the metadata table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Produced by {@link InventoryScanner} from filename conventions, or by any external tool writing the same table.</li>
 *   <li>Read back by {@link MetadataTableReader}; row order of the table is preserved and is the tie-break order for cloth references.</li>
 *   <li>{@code path} is the unique key and is what {@link CubeLoaderInterface} is given.</li>
 * </ul>
 *
 * @param path Path of the cube header (or data file when no header path is listed)
 * @param sensor Sensor modality
 * @param isReference true for calibration-cloth captures
 * @param timepoint Sampling timepoint label, e.g. "D0", "2h", "before"
 * @param fileName File name as listed in the table
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public record SampleRecord(
    String path,
    Sensor sensor,
    boolean isReference,
    String timepoint,
    String fileName
) {}
