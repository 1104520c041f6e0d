package com.smartagriculture.spectra;

import java.io.IOException;

/**
 * Interface for decoding hyperspectral cubes from disk.
 * <p>
 * Implementations must be stateless with respect to the pipeline: the same path always yields the same cube.
 */
public interface CubeLoaderInterface {
    /**
     * Loads the cube stored at the given path.
     * @param path Path to the cube header (or data file)
     * @return Cube values and wavelengths; {@code wavelengths.length} equals the band axis length
     * @throws IOException if the file cannot be read or decoded
     */
    HyperspectralCube load(String path) throws IOException;
}
