package org.photomosaic.error;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Base of every failure the mosaic pipeline reports to its caller.
 * Unchecked, like the I/O wrapping done at the other module boundaries.
 */
public abstract class MosaicException extends RuntimeException {

    private final Path path;

    protected MosaicException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    protected MosaicException(String message, Path path) {
        this(message, path, null);
    }

    /**
     * @return the file or directory the failure is about, if there is one
     */
    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }
}
