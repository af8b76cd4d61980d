package org.photomosaic.dictionary;

import org.photomosaic.model.Color3f;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A tile file that still has to be decoded.
 * When the cache already knows its color only the pixel buffer is produced.
 */
public record PendingTile(String id, Path path, Color3f knownColor) {

    public PendingTile {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
