package org.photomosaic.error;

import java.nio.file.Path;

/**
 * The tile source directory could not be listed.
 */
public class SourceUnreadableException extends MosaicException {

    public SourceUnreadableException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public SourceUnreadableException(String message, Path path) {
        super(message, path);
    }
}
