package org.photomosaic.error;

import java.nio.file.Path;

/**
 * Raised when a color index would be built from zero tiles.
 */
public class EmptyDictionaryException extends MosaicException {

    public EmptyDictionaryException(Path source) {
        super(source == null
                ? "Dictionary contains no usable tiles"
                : "Dictionary contains no usable tiles: " + source, source);
    }
}
