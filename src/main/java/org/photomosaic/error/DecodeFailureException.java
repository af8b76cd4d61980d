package org.photomosaic.error;

import java.nio.file.Path;

/**
 * An image (tile, target or frame) could not be read or decoded.
 */
public class DecodeFailureException extends MosaicException {

    public DecodeFailureException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public DecodeFailureException(String message, Path path) {
        super(message, path);
    }
}
