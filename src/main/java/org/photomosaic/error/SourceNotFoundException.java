package org.photomosaic.error;

import java.nio.file.Path;

/**
 * The tile source directory does not exist and could not be created.
 */
public class SourceNotFoundException extends MosaicException {

    public SourceNotFoundException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public SourceNotFoundException(String message, Path path) {
        super(message, path);
    }
}
