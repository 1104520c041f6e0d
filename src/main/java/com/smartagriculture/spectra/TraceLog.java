package com.smartagriculture.spectra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Append-only trace log: one line per run, {@code <ISO-8601 UTC>,<kind>,key=value,...}.
 */
public class TraceLog {
    private static final Logger logger = LoggerFactory.getLogger(TraceLog.class);

    private final Path file;
    private final Clock clock;

    public TraceLog(Path file) {
        this(file, Clock.systemUTC());
    }

    public TraceLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    /**
     * Appends one line.
     * @param kind Run kind, e.g. "export_spectra" or "self_check"
     * @param fields Ordered key/value pairs
     * @return The line written, without its newline
     */
    public String append(String kind, Map<String, String> fields) throws IOException {
        StringBuilder line = new StringBuilder(Instant.now(clock).truncatedTo(ChronoUnit.MICROS).toString())
            .append(',').append(kind);
        fields.forEach((k, v) -> line.append(',').append(k).append('=').append(v));
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.writeString(file, line + "\n", StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        logger.debug("Trace: {}", line);
        return line.toString();
    }
}
