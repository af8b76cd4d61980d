package org.photomosaic.error;

import java.nio.file.Path;

/**
 * The tile source path exists but is a regular file.
 */
public class SourceIsFileException extends MosaicException {

    public SourceIsFileException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public SourceIsFileException(String message, Path path) {
        super(message, path);
    }
}
