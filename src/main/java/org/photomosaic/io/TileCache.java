package org.photomosaic.io;

import org.photomosaic.error.CorruptCacheException;
import org.photomosaic.model.Color3f;

import java.nio.file.Path;
import java.util.Map;

/**
 * Persisted mapping from tile identity (path relative to the tile source) to its representative color.
 *
 * Implementations should:
 * - return an immutable map that keeps the stored order
 * - never leave a half-written cache visible to the next reader
 */
public interface TileCache {

    /**
     * Loads the cache stored inside the tile source.
     *
     * @return the stored entries, or an empty map if there is no cache file
     * @throws CorruptCacheException if a cache file exists but cannot be parsed
     */
    Map<String, Color3f> load(Path sourceRoot);

    /**
     * Replaces the cache stored inside the tile source.
     *
     * @throws java.io.UncheckedIOException if the cache cannot be written
     */
    void save(Path sourceRoot, Map<String, Color3f> entries);

    /**
     * @return true if the file is the cache itself or one of its temporary files,
     * and therefore must not be treated as a tile
     */
    boolean owns(Path file);
}
