package org.photomosaic.dictionary;

import org.photomosaic.error.EmptyDictionaryException;
import org.photomosaic.metrics.ColorIndex;
import org.photomosaic.model.Color3f;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a merged build: the color index, the cache content to persist and the skipped tiles.
 */
public final class DictionaryResult {

    private final Path root;
    private final ColorIndex index;
    private final Map<String, Color3f> cacheEntries;
    private final List<TileFailure> failures;
    private final DictionaryStats stats;

    DictionaryResult(Path root, ColorIndex index, Map<String, Color3f> cacheEntries,
                     List<TileFailure> failures, DictionaryStats stats) {
        this.root = root;
        this.index = index;
        this.cacheEntries = Collections.unmodifiableMap(new LinkedHashMap<>(cacheEntries));
        this.failures = List.copyOf(failures);
        this.stats = stats;
    }

    /**
     * @return the finalized index
     * @throws EmptyDictionaryException if the source produced no usable tile
     */
    public ColorIndex index() {
        if (index == null) {
            throw new EmptyDictionaryException(root);
        }
        return index;
    }

    public boolean isEmpty() {
        return index == null;
    }

    /**
     * @return number of tiles in the index (0 when empty)
     */
    public int size() {
        return index == null ? 0 : index.size();
    }

    /**
     * Identity to linear color for every tile of the index, in index order.
     */
    public Map<String, Color3f> cacheEntries() {
        return cacheEntries;
    }

    public List<TileFailure> failures() {
        return failures;
    }

    public DictionaryStats stats() {
        return stats;
    }

    public Path root() {
        return root;
    }
}
