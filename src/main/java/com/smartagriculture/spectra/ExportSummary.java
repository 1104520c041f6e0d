package com.smartagriculture.spectra;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Totals of one export run.
 *
 * @param written Spectrum files written
 * @param failed Samples that ended in ERR
 * @param degraded Samples whose resolved mode was downgraded to NONE
 * @param modeCounts Files per recorded mode
 * @param outputs Paths written, in processing order
 */
public record ExportSummary(int written, int failed, int degraded, Map<String, Integer> modeCounts, List<Path> outputs) {}
