package com.smartagriculture.spectra.envi;

import com.smartagriculture.spectra.HyperspectralCube;
import com.smartagriculture.spectra.SpectralMath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnviCubeLoaderTest {
    @TempDir
    Path dir;

    private final EnviCubeLoader loader = new EnviCubeLoader();

    private Path writeHeader(String name, String body) throws Exception {
        Path hdr = dir.resolve(name + ".hdr");
        Files.writeString(hdr, "ENVI\n" + body);
        return hdr;
    }

    @Test
    void testLoadsFloatBil() throws Exception {
        Path hdr = writeHeader("leaf", String.join("\n",
            "samples = 2", "lines = 1", "bands = 3", "header offset = 0", "data type = 4",
            "interleave = bil", "byte order = 0", "wavelength = {", " 500.0, 600.0,", " 700.0}", ""));
        ByteBuffer buf = ByteBuffer.allocate(6 * 4).order(ByteOrder.LITTLE_ENDIAN);
        // band-major per line: b0(s0,s1), b1(s0,s1), b2(s0,s1)
        for (float v : new float[]{1f, 3f, 2f, 4f, 3f, 5f}) buf.putFloat(v);
        Files.write(dir.resolve("leaf.bil"), buf.array());

        HyperspectralCube cube = loader.load(hdr.toString());
        assertArrayEquals(new double[]{500.0, 600.0, 700.0}, cube.wavelengths(), 0.0);
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, cube.values()[0][0], 0.0);
        assertArrayEquals(new double[]{2.0, 3.0, 4.0}, SpectralMath.reduce(cube), 1e-12);

        HyperspectralCube viaRaster = loader.load(dir.resolve("leaf.bil").toString());
        assertArrayEquals(cube.values()[0][1], viaRaster.values()[0][1], 0.0);
    }

    @Test
    void testChunkedReadMatchesSingleRead() throws Exception {
        Path hdr = writeHeader("chunks", String.join("\n",
            "samples = 3", "lines = 2", "bands = 4", "header offset = 5", "data type = 5", "interleave = bip", ""));
        ByteBuffer buf = ByteBuffer.allocate(5 + 24 * 8).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[5]);
        for (int i = 0; i < 24; i++) buf.putDouble(i * 0.5);
        Files.write(dir.resolve("chunks.bip"), buf.array());

        HyperspectralCube whole = loader.load(hdr.toString());
        // 12-byte chunks round down to one float64 per read
        HyperspectralCube chunked = new EnviCubeLoader(12, 0).load(hdr.toString());
        for (int l = 0; l < 2; l++) {
            for (int s = 0; s < 3; s++) {
                assertArrayEquals(whole.values()[l][s], chunked.values()[l][s], 0.0);
            }
        }
        assertArrayEquals(new double[]{10.0, 10.5, 11.0, 11.5}, chunked.values()[1][2], 0.0);
    }

    @Test
    void testCubeAboveMemoryLimitIsRejectedBeforeReading() throws Exception {
        Path hdr = writeHeader("huge", String.join("\n",
            "samples = 2", "lines = 1", "bands = 3", "data type = 4", "interleave = bil", ""));
        Files.write(dir.resolve("huge.bil"), new byte[6 * 4]);
        CubeFormatException e = assertThrows(CubeFormatException.class,
            () -> new EnviCubeLoader(1024, 5).load(hdr.toString()));
        assertTrue(e.getMessage().contains("6 values"));
    }

    @Test
    void testLoadsBigEndianInt16Bsq() throws Exception {
        Path hdr = writeHeader("swir", String.join("\n",
            "samples = 1", "lines = 2", "bands = 2", "data type = 2", "interleave = bsq", "byte order = 1", ""));
        ByteBuffer buf = ByteBuffer.allocate(4 * 2).order(ByteOrder.BIG_ENDIAN);
        // band 0 for lines 0..1, then band 1
        for (short v : new short[]{10, 20, -5, 7}) buf.putShort(v);
        Files.write(dir.resolve("swir.img"), buf.array());

        HyperspectralCube cube = loader.load(hdr.toString());
        assertArrayEquals(new double[]{10.0, -5.0}, cube.values()[0][0], 0.0);
        assertArrayEquals(new double[]{20.0, 7.0}, cube.values()[1][0], 0.0);
        // no wavelength list: band indices
        assertArrayEquals(new double[]{0.0, 1.0}, cube.wavelengths(), 0.0);
    }

    @Test
    void testMalformedWavelengthsFallBackToIndices() throws Exception {
        Path hdr = writeHeader("bad", String.join("\n",
            "samples = 1", "lines = 1", "bands = 2", "data type = 1", "interleave = bip", "wavelength = {abc, 700}", ""));
        Files.write(dir.resolve("bad.raw"), new byte[]{(byte) 200, 3});
        HyperspectralCube cube = loader.load(hdr.toString());
        assertArrayEquals(new double[]{0.0, 1.0}, cube.wavelengths(), 0.0);
        assertArrayEquals(new double[]{200.0, 3.0}, cube.values()[0][0], 0.0);
    }

    @Test
    void testTruncatedRasterIsFormatError() throws Exception {
        Path hdr = writeHeader("short", String.join("\n",
            "samples = 4", "lines = 4", "bands = 4", "data type = 4", "interleave = bsq", ""));
        Files.write(dir.resolve("short.bsq"), new byte[8]);
        assertThrows(CubeFormatException.class, () -> loader.load(hdr.toString()));
    }

    @Test
    void testMissingRaster() throws Exception {
        Path hdr = writeHeader("alone", "samples = 1\nlines = 1\nbands = 1\ndata type = 4\n");
        assertNull(EnviCubeLoader.findRaster(hdr));
        assertThrows(NoSuchFileException.class, () -> loader.load(hdr.toString()));
    }

    @Test
    void testMissingRequiredField() throws Exception {
        Path hdr = writeHeader("nobands", "samples = 1\nlines = 1\ndata type = 4\n");
        Files.write(dir.resolve("nobands.bil"), new byte[4]);
        CubeFormatException e = assertThrows(CubeFormatException.class, () -> loader.load(hdr.toString()));
        assertTrue(e.getMessage().contains("bands"));
    }

    @Test
    void testHeaderParsesMultilineBraces() throws Exception {
        EnviHeader header = EnviHeader.parse("ENVI\ndescription = {first\nsecond}\nWavelength = {1, 2,\n3}\n");
        assertEquals("first second", header.get("description").orElseThrow());
        assertEquals(List.of("1", "2", "3"), header.list("wavelength"));
        assertThrows(CubeFormatException.class, () -> EnviHeader.parse("ENVI\nwavelength = {1, 2\n"));
    }
}
