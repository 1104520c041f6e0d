package com.smartagriculture.spectra.envi;

import java.io.IOException;

/**
 * Raised when an ENVI header or raster cannot be decoded.
 * A subclass of {@link IOException} so callers treat it as an unreadable cube.
 */
public class CubeFormatException extends IOException {
    public CubeFormatException(String message) {
        super(message);
    }

    public CubeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
