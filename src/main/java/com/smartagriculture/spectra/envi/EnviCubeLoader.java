package com.smartagriculture.spectra.envi;

import com.smartagriculture.spectra.CubeLoaderInterface;
import com.smartagriculture.spectra.HyperspectralCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;

/**
 * Loads ENVI hyperspectral cubes (header plus raw raster) into memory.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Accepts either the {@code .hdr} path or the raster path; the other file is located next to it.</li>
 *   <li>Reads {@code samples}, {@code lines}, {@code bands}, {@code data type}, {@code interleave}, {@code byte order} and {@code header offset}.</li>
 *   <li>Decodes data types 1 (uint8), 2 (int16), 3 (int32), 4 (float32), 5 (float64) and 12 (uint16) from BSQ, BIL or BIP layouts.</li>
 *   <li>Reads the raster through the channel in fixed-size chunks, so file size is not bounded by a single buffer.
 *       A cube too large for the heap is rejected with {@link CubeFormatException} before anything is allocated.</li>
 *   <li>Wavelengths come from the {@code wavelength} list; when it is absent, unparsable, or of the wrong length the band indices are used instead.</li>
 * </ul>
 *
 * @author Smart Agriculture Spectra Team
 * @since 1.0
 */
public class EnviCubeLoader implements CubeLoaderInterface {
    private static final Logger logger = LoggerFactory.getLogger(EnviCubeLoader.class);

    private static final List<String> RASTER_EXTENSIONS = List.of(".bil", ".bsq", ".bip", ".img", ".raw", ".dat", "");
    private static final int DEFAULT_CHUNK_BYTES = 8 * 1024 * 1024;

    private final int chunkBytes;
    private final long maxValues;

    public EnviCubeLoader() {
        this(DEFAULT_CHUNK_BYTES, 0);
    }

    /**
     * @param chunkBytes Size of each raster read; rasters of any size are read in chunks of at most this many bytes
     * @param maxValues Largest cube (in values) accepted, or 0 to derive it from the JVM heap limit
     */
    public EnviCubeLoader(int chunkBytes, long maxValues) {
        if (chunkBytes < Double.BYTES) {
            throw new IllegalArgumentException("chunkBytes must be at least " + Double.BYTES + ", got " + chunkBytes);
        }
        this.chunkBytes = chunkBytes;
        this.maxValues = maxValues;
    }

    @Override
    public HyperspectralCube load(String path) throws IOException {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Cube path cannot be null or empty");
        }
        Path given = Paths.get(path);
        Path hdr;
        Path raster;
        if (given.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".hdr")) {
            hdr = given;
            raster = findRaster(hdr);
            if (raster == null) throw new NoSuchFileException(path, null, "No raster file found next to header");
        } else {
            raster = given;
            hdr = findHeader(raster);
            if (hdr == null) throw new NoSuchFileException(path, null, "No .hdr file found next to raster");
        }
        if (!Files.exists(hdr)) throw new NoSuchFileException(hdr.toString());

        EnviHeader header = EnviHeader.read(hdr);
        int samples = header.requireInt("samples");
        int lines = header.requireInt("lines");
        int bands = header.requireInt("bands");
        int dataType = header.requireInt("data type");
        int offset = header.intOrDefault("header offset", 0);
        int byteOrder = header.intOrDefault("byte order", 0);
        String interleave = header.get("interleave").orElse("bsq").trim().toLowerCase(Locale.ROOT);
        if (samples <= 0 || lines <= 0 || bands <= 0) {
            throw new CubeFormatException("Invalid cube dimensions " + lines + "x" + samples + "x" + bands + " in " + hdr);
        }

        int width = bytesPerValue(dataType);
        long count = (long) samples * lines * bands;
        long needed = count * width;
        long limit = maxValues > 0 ? maxValues : Runtime.getRuntime().maxMemory() / 2 / Double.BYTES;
        if (count > limit) {
            throw new CubeFormatException("Cube " + hdr + " holds " + count + " values, more than the " + limit + " this loader may hold in memory");
        }
        double[][][] values = new double[lines][samples][bands];
        try (FileChannel ch = FileChannel.open(raster, StandardOpenOption.READ)) {
            if (ch.size() < offset + needed) {
                throw new CubeFormatException("Raster " + raster + " holds " + ch.size() + " bytes, header implies " + (offset + needed));
            }
            ByteBuffer buf = ByteBuffer.allocate((int) Math.min(needed, chunkBytes - chunkBytes % width));
            buf.order(byteOrder == 1 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
            long position = offset;
            long i = 0;
            while (i < count) {
                buf.clear();
                buf.limit((int) Math.min(buf.capacity(), (count - i) * width));
                while (buf.hasRemaining()) {
                    if (ch.read(buf, position + buf.position()) < 0) {
                        throw new CubeFormatException("Raster " + raster + " ended early at byte " + (position + buf.position()));
                    }
                }
                position += buf.limit();
                buf.flip();
                for (; buf.hasRemaining(); i++) {
                    double v = readValue(buf, dataType);
                    int l, s, b;
                    switch (interleave) {
                        case "bil" -> {
                            s = (int) (i % samples);
                            b = (int) ((i / samples) % bands);
                            l = (int) (i / ((long) samples * bands));
                        }
                        case "bip" -> {
                            b = (int) (i % bands);
                            s = (int) ((i / bands) % samples);
                            l = (int) (i / ((long) bands * samples));
                        }
                        case "bsq" -> {
                            s = (int) (i % samples);
                            l = (int) ((i / samples) % lines);
                            b = (int) (i / ((long) samples * lines));
                        }
                        default -> throw new CubeFormatException("Unsupported interleave '" + interleave + "' in " + hdr);
                    }
                    values[l][s][b] = v;
                }
            }
        }
        double[] wavelengths = wavelengths(header, bands, hdr);
        logger.debug("Loaded cube {} ({}x{}x{}, {})", raster, lines, samples, bands, interleave);
        return new HyperspectralCube(values, wavelengths);
    }

    /**
     * Finds the raster file accompanying a header, or null when none exists.
     */
    public static Path findRaster(Path hdr) {
        String name = hdr.getFileName().toString();
        String stem = name.substring(0, name.length() - ".hdr".length());
        for (String ext : RASTER_EXTENSIONS) {
            for (String candidate : List.of(stem + ext, stem + ext.toUpperCase(Locale.ROOT))) {
                Path p = hdr.resolveSibling(candidate);
                if (Files.isRegularFile(p)) return p;
            }
        }
        return null;
    }

    static Path findHeader(Path raster) {
        String name = raster.getFileName().toString();
        Path appended = raster.resolveSibling(name + ".hdr");
        if (Files.isRegularFile(appended)) return appended;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            Path replaced = raster.resolveSibling(name.substring(0, dot) + ".hdr");
            if (Files.isRegularFile(replaced)) return replaced;
        }
        return null;
    }

    static double[] wavelengths(EnviHeader header, int bands, Path hdr) {
        List<String> items = header.list("wavelength");
        double[] wl = new double[bands];
        if (items.size() == bands) {
            try {
                for (int i = 0; i < bands; i++) wl[i] = Double.parseDouble(items.get(i));
                return wl;
            } catch (NumberFormatException e) {
                logger.warn("Unparsable wavelength list in {}: {}; using band indices", hdr, e.getMessage());
            }
        } else {
            logger.warn("Header {} lists {} wavelengths for {} bands; using band indices", hdr, items.size(), bands);
        }
        for (int i = 0; i < bands; i++) wl[i] = i;
        return wl;
    }

    private static int bytesPerValue(int dataType) throws CubeFormatException {
        return switch (dataType) {
            case 1 -> 1;
            case 2, 12 -> 2;
            case 3, 4 -> 4;
            case 5 -> 8;
            default -> throw new CubeFormatException("Unsupported ENVI data type " + dataType);
        };
    }

    private static double readValue(ByteBuffer buf, int dataType) {
        return switch (dataType) {
            case 1 -> buf.get() & 0xFF;
            case 2 -> buf.getShort();
            case 12 -> buf.getShort() & 0xFFFF;
            case 3 -> buf.getInt();
            case 4 -> buf.getFloat();
            default -> buf.getDouble();
        };
    }
}
