package org.photomosaic.error;

import java.nio.file.Path;

/**
 * A dictionary cache file exists but its content cannot be parsed.
 * Callers recover by rebuilding every color from pixels.
 */
public class CorruptCacheException extends MosaicException {

    public CorruptCacheException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public CorruptCacheException(String message, Path path) {
        super(message, path);
    }
}
