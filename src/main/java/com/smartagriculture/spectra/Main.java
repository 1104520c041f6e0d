package com.smartagriculture.spectra;

import com.smartagriculture.spectra.envi.EnviCubeLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Main entry point for the hyperspectral spectra pipeline.
 * Scans raw cubes into a metadata table, exports normalized mean spectra and validates the result.
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final List<String> COMMANDS = List.of("inventory", "export", "self-check", "all");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Loads the configuration from system properties and environment, then dispatches.
     * @param args Command line arguments
     * @return Process exit code
     */
    static int run(String[] args) {
        PipelineConfig config;
        try {
            config = PipelineConfig.fromEnvironment();
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("[ERR] invalid configuration: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return run(args, config, new EnviCubeLoader(), System.out);
    }

    /**
     * Dispatches one command.
     * <ul>
     *   <li>{@code inventory}: build the metadata table</li>
     *   <li>{@code export}: normalize and write every non-reference spectrum</li>
     *   <li>{@code self-check}: validate the outputs, exit code 0 on PASS and 1 on FAIL</li>
     *   <li>{@code all}: the three in order, stopping at the first failure</li>
     * </ul>
     * An optional {@code --mode=<MODE>} argument overrides the configured normalization mode.
     * @param args Command line arguments
     * @param config Configuration loaded at startup
     * @param loader Cube loader used by the export step
     * @param console Stream receiving the per-sample and report lines
     * @return Process exit code
     */
    static int run(String[] args, PipelineConfig config, CubeLoaderInterface loader, PrintStream console) {
        if (args == null || args.length == 0 || !COMMANDS.contains(args[0])) {
            printUsage(console);
            return EXIT_USAGE;
        }
        String command = args[0];
        try {
            for (int i = 1; i < args.length; i++) {
                if (args[i].startsWith("--mode=")) {
                    config = config.withNormMode(NormalizationMode.parseConfigured(args[i].substring("--mode=".length())));
                } else {
                    console.println("Unknown option: " + args[i]);
                    printUsage(console);
                    return EXIT_USAGE;
                }
            }
            logger.info("Running '{}' with mode {}", command, config.normMode());

            switch (command) {
                case "inventory" -> new InventoryScanner().scan(config);
                case "export" -> new SpectrumExporter(loader, new MetadataTableReader(), new ModeResolver(), new Normalizer(), console)
                    .export(config);
                case "self-check" -> {
                    return new SelfCheckValidator(console).run(config).exitCode();
                }
                default -> {
                    new InventoryScanner().scan(config);
                    new SpectrumExporter(loader, new MetadataTableReader(), new ModeResolver(), new Normalizer(), console)
                        .export(config);
                    return new SelfCheckValidator(console).run(config).exitCode();
                }
            }
            return EXIT_OK;
        } catch (NoSuchFileException e) {
            logger.error("Required input missing: {}", e.getMessage());
            console.println("[ERR] missing " + e.getFile() + (e.getReason() != null ? " (" + e.getReason() + ")" : ""));
            return EXIT_FAILURE;
        } catch (BaselineMismatchException | IllegalArgumentException e) {
            logger.error("Run aborted: {}", e.getMessage());
            console.println("[ERR] " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("I/O failure during '{}': {}", command, e.getMessage(), e);
            console.println("[ERR] " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void printUsage(PrintStream console) {
        console.println("Usage: hsi-spectra <" + String.join("|", COMMANDS) + "> [--mode=<AUTO|CLOTH|BASELINE|ZSCORE>]");
        console.println("Settings: " + PipelineConfig.NORM_MODE + ", " + PipelineConfig.BASELINE_TIMEPOINT + ", "
            + PipelineConfig.DATA_DIR + ", " + PipelineConfig.OUT_DIR + ", " + PipelineConfig.REPORTS_DIR + ", "
            + PipelineConfig.BASELINE_INTEGRITY_CHECK + ", " + PipelineConfig.CONFIG_FILE);
    }
}
