package org.photomosaic.dictionary;

import org.photomosaic.model.Color3f;
import org.photomosaic.model.TileSize;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of opening a tile source: what the cache already knows and what is left to decode.
 * Immutable; chunks only read from it.
 */
public final class DictionaryHandle {

    private final Path root;
    private final TileSize tileSize;
    private final Map<String, Color3f> cachedColors;
    private final List<PendingTile> pending;
    private final int fileCount;
    private final int pruned;

    DictionaryHandle(Path root, TileSize tileSize, Map<String, Color3f> cachedColors,
                     List<PendingTile> pending, int fileCount, int pruned) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.tileSize = tileSize;
        this.cachedColors = Collections.unmodifiableMap(new LinkedHashMap<>(cachedColors));
        this.pending = List.copyOf(pending);
        this.fileCount = fileCount;
        this.pruned = pruned;
    }

    public Path root() {
        return root;
    }

    /**
     * @return the tile size of a compose-mode build, empty for a colors-only build
     */
    public Optional<TileSize> tileSize() {
        return Optional.ofNullable(tileSize);
    }

    /**
     * Cached colors still backed by a file, keyed by tile identity, in cache file order.
     */
    public Map<String, Color3f> cachedColors() {
        return cachedColors;
    }

    /**
     * Files that must be decoded, in listing order.
     */
    public List<PendingTile> pending() {
        return pending;
    }

    /**
     * @return number of tile files in the source (cached + uncached)
     */
    public int size() {
        return fileCount;
    }

    public int pruned() {
        return pruned;
    }
}
