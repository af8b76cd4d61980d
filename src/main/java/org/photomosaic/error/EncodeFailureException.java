package org.photomosaic.error;

import java.nio.file.Path;

/**
 * The output canvas could not be encoded or written.
 */
public class EncodeFailureException extends MosaicException {

    public EncodeFailureException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public EncodeFailureException(String message, Path path) {
        super(message, path);
    }
}
