package org.photomosaic.dictionary;

import java.nio.file.Path;

/**
 * A tile skipped during the build, with the reason it could not be used.
 */
public record TileFailure(String id, Path path, String reason) {

    static TileFailure of(PendingTile tile, Exception cause) {
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new TileFailure(tile.id(), tile.path(), reason);
    }
}
