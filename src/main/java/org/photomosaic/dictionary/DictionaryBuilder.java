package org.photomosaic.dictionary;

import org.photomosaic.color.ComparisonSpace;
import org.photomosaic.concurrent.WorkerPool;
import org.photomosaic.error.CorruptCacheException;
import org.photomosaic.error.InconsistentTileSizeException;
import org.photomosaic.error.SourceIsFileException;
import org.photomosaic.error.SourceNotFoundException;
import org.photomosaic.error.SourceUnreadableException;
import org.photomosaic.io.ImageCodec;
import org.photomosaic.io.TileCache;
import org.photomosaic.metrics.ColorIndex;
import org.photomosaic.metrics.ColorMetric;
import org.photomosaic.metrics.SquaredEuclideanDistance;
import org.photomosaic.model.Color3f;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.Tile;
import org.photomosaic.model.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link ColorIndex} from a directory of tile images, reusing cached colors.
 * <p>
 * Lifecycle: {@link #open} lists the source and splits it into cached and pending tiles,
 * {@link #partition} cuts the pending tiles into independent chunks, each chunk is
 * processed by one worker, and {@link #merge} combines everything once all chunks are
 * exhausted. {@link #build} runs the whole sequence and persists the cache.
 * <p>
 * With a {@link TileSize} (compose mode) every tile also gets a resized pixel buffer, so
 * cached tiles are decoded again for their pixels but their color is not recomputed.
 * Without one (colors-only mode) cached tiles are not touched at all.
 */
public final class DictionaryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryBuilder.class);

    private final ImageCodec codec;
    private final TileCache cache;
    private final TileSize tileSize;
    private final ComparisonSpace space;
    private final ColorMetric metric;
    private final int workers;

    /**
     * @param codec    image decoder (non-null)
     * @param cache    color cache (non-null)
     * @param tileSize pixel size of the tiles, or null for a colors-only dictionary
     * @param space    comparison space of the resulting index (non-null)
     * @param metric   distance strategy of the resulting index (non-null)
     * @param workers  worker count, 0 or less for the available parallelism
     */
    public DictionaryBuilder(ImageCodec codec, TileCache cache, TileSize tileSize,
                             ComparisonSpace space, ColorMetric metric, int workers) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.space = Objects.requireNonNull(space, "space must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.tileSize = tileSize;
        this.workers = workers <= 0 ? WorkerPool.defaultSize() : workers;
    }

    public DictionaryBuilder(ImageCodec codec, TileCache cache, TileSize tileSize) {
        this(codec, cache, tileSize, ComparisonSpace.CIELAB, new SquaredEuclideanDistance(), 0);
    }

    /**
     * Lists the tile source and separates cached tiles from the ones that must be decoded.
     * A missing directory is created. Cache entries whose file is gone are pruned.
     *
     * @throws SourceNotFoundException   if the directory is missing and cannot be created
     * @throws SourceIsFileException     if the path is a regular file
     * @throws SourceUnreadableException if the directory cannot be listed
     */
    public DictionaryHandle open(Path sourceRoot) {
        Objects.requireNonNull(sourceRoot, "sourceRoot must not be null");
        Path root = sourceRoot.toAbsolutePath().normalize();

        if (!Files.exists(root)) {
            try {
                Files.createDirectories(root);
                logger.info("Created empty dictionary folder {}", root);
            } catch (IOException e) {
                throw new SourceNotFoundException("Could not create dictionary folder", root, e);
            }
        } else if (!Files.isDirectory(root)) {
            throw new SourceIsFileException("Dictionary can't be a file", root);
        }

        List<Path> files = listTiles(root);

        Map<String, Color3f> stored;
        try {
            stored = cache.load(root);
        } catch (CorruptCacheException e) {
            logger.warn("Ignoring unreadable dictionary cache ({}), all colors will be recomputed", e.getMessage());
            stored = Map.of();
        }

        Map<String, Path> byId = new LinkedHashMap<>();
        for (Path file : files) {
            byId.put(identityOf(root, file), file);
        }

        Map<String, Color3f> cached = new LinkedHashMap<>();
        int pruned = 0;
        for (Map.Entry<String, Color3f> entry : stored.entrySet()) {
            if (byId.containsKey(entry.getKey())) {
                cached.put(entry.getKey(), entry.getValue());
            } else {
                pruned++;
            }
        }
        if (pruned > 0) {
            logger.warn("Pruned {} cache entries whose file no longer exists", pruned);
        }

        List<PendingTile> pending = new ArrayList<>();
        for (Map.Entry<String, Path> entry : byId.entrySet()) {
            Color3f known = cached.get(entry.getKey());
            if (known == null) {
                pending.add(new PendingTile(entry.getKey(), entry.getValue(), null));
            } else if (tileSize != null) {
                pending.add(new PendingTile(entry.getKey(), entry.getValue(), known));
            }
        }

        logger.info("Loading {} images from {} ({} cached colors, {} files to decode)",
                files.size(), root, cached.size(), pending.size());
        return new DictionaryHandle(root, tileSize, cached, pending, files.size(), pruned);
    }

    /**
     * Splits the pending tiles into {@code chunkCount} contiguous, non-overlapping chunks.
     * Chunk lengths differ by at most one, the longer chunks coming first. With fewer pending
     * tiles than chunks every chunk holds one tile, so no chunk is ever empty.
     */
    public List<DictionaryChunk> partition(DictionaryHandle handle, int chunkCount) {
        Objects.requireNonNull(handle, "handle must not be null");
        if (chunkCount <= 0) throw new IllegalArgumentException("chunkCount must be >= 1");

        List<PendingTile> pending = handle.pending();
        if (pending.isEmpty()) {
            return List.of();
        }

        int count = Math.min(chunkCount, pending.size());
        int base = pending.size() / count;
        int longer = pending.size() % count;
        List<DictionaryChunk> chunks = new ArrayList<>(count);
        int from = 0;
        for (int i = 0; i < count; i++) {
            int to = from + base + (i < longer ? 1 : 0);
            chunks.add(new DictionaryChunk(handle, i, pending.subList(from, to), codec));
            from = to;
        }
        logger.debug("Partitioned {} pending tiles into {} chunks", pending.size(), chunks.size());
        return chunks;
    }

    /**
     * Combines cached entries and every chunk result into one index.
     * Must only be called once every chunk is exhausted.
     *
     * @throws IllegalStateException         if a chunk still has pending files
     * @throws InconsistentTileSizeException if a pixel buffer does not match the tile size
     */
    public DictionaryResult merge(DictionaryHandle handle, List<DictionaryChunk> chunks) {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(chunks, "chunks must not be null");

        List<Tile> tiles = new ArrayList<>();
        List<TileFailure> failures = new ArrayList<>();
        int cacheHits = 0;
        int computed = 0;
        int decodes = 0;

        if (handle.tileSize().isEmpty()) {
            for (Map.Entry<String, Color3f> entry : handle.cachedColors().entrySet()) {
                tiles.add(new Tile(entry.getKey(), entry.getValue()));
                cacheHits++;
            }
        }

        for (DictionaryChunk chunk : chunks) {
            if (chunk.origin() != handle) {
                throw new IllegalArgumentException("Chunk " + chunk.index() + " belongs to another dictionary");
            }
            if (!chunk.isExhausted()) {
                throw new IllegalStateException(
                        "Chunk " + chunk.index() + " still has " + chunk.remaining() + " files to process");
            }
            tiles.addAll(chunk.tiles());
            failures.addAll(chunk.failures());
            cacheHits += chunk.cacheHits();
            computed += chunk.colorsComputed();
            decodes += chunk.decodes();
        }

        handle.tileSize().ifPresent(size -> {
            for (Tile tile : tiles) {
                PixelGrid px = tile.requirePixels();
                if (!size.matches(px)) {
                    throw new InconsistentTileSizeException(tile.id(), size.width(), size.height(), px.width(), px.height());
                }
            }
        });

        Map<String, Color3f> entries = new LinkedHashMap<>();
        for (Tile tile : tiles) {
            entries.put(tile.id(), tile.color());
        }

        ColorIndex index = tiles.isEmpty() ? null : new ColorIndex(tiles, space, metric);
        DictionaryStats stats = new DictionaryStats(cacheHits, computed, decodes, failures.size(), handle.pruned());
        logger.info("Dictionary ready: {} tiles ({} from cache, {} computed, {} skipped)",
                tiles.size(), cacheHits, computed, failures.size());
        return new DictionaryResult(handle.root(), index, entries, failures, stats);
    }

    /**
     * Opens, processes in parallel, merges and saves the cache in one call.
     */
    public DictionaryResult build(Path sourceRoot) {
        DictionaryHandle handle = open(sourceRoot);
        List<DictionaryChunk> chunks = partition(handle, workers);

        if (!chunks.isEmpty()) {
            try (WorkerPool pool = new WorkerPool("dictionary", Math.min(workers, chunks.size()))) {
                pool.runAll(chunks.stream().map(c -> (Runnable) c::processAll).toList());
            }
        }

        DictionaryResult result = merge(handle, chunks);
        try {
            cache.save(handle.root(), result.cacheEntries());
        } catch (UncheckedIOException e) {
            logger.warn("Could not save dictionary cache: {}", e.getMessage());
        }
        return result;
    }

    public int workers() {
        return workers;
    }

    private List<Path> listTiles(Path root) {
        try (Stream<Path> entries = Files.list(root)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> !cache.owns(p))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SourceUnreadableException("Could not read directory", root, e);
        }
    }

    /**
     * Identity of a tile: its path relative to the source root, with '/' separators.
     */
    static String identityOf(Path root, Path file) {
        String relative = root.relativize(file).toString();
        return File.separatorChar == '/' ? relative : relative.replace(File.separatorChar, '/');
    }
}
