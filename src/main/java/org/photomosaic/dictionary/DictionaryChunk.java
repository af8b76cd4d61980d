package org.photomosaic.dictionary;

import org.photomosaic.color.ColorSpaces;
import org.photomosaic.error.DecodeFailureException;
import org.photomosaic.io.ImageCodec;
import org.photomosaic.model.Color3f;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.PixelGrids;
import org.photomosaic.model.Tile;
import org.photomosaic.model.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A contiguous slice of the pending tiles with its own private results.
 * <p>
 * A chunk is confined to one worker while it is processed; nothing is shared with other
 * chunks, so no locking is needed. Results are read by {@link DictionaryBuilder#merge}
 * once every chunk is exhausted.
 */
public final class DictionaryChunk {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryChunk.class);

    private final DictionaryHandle origin;
    private final int index;
    private final ImageCodec codec;
    private final TileSize tileSize;
    private final Deque<PendingTile> remaining;

    private final List<Tile> tiles = new ArrayList<>();
    private final List<TileFailure> failures = new ArrayList<>();
    private int colorsComputed;
    private int cacheHits;
    private int decodes;

    DictionaryChunk(DictionaryHandle origin, int index, List<PendingTile> slice, ImageCodec codec) {
        this.origin = origin;
        this.index = index;
        this.codec = codec;
        this.tileSize = origin.tileSize().orElse(null);
        this.remaining = new ArrayDeque<>(slice);
    }

    /**
     * Decodes the next pending file and records its tile.
     * A file that cannot be decoded is recorded as a failure and skipped.
     *
     * @return false once the chunk is exhausted, true if a file was consumed
     */
    public boolean processOne() {
        PendingTile next = remaining.poll();
        if (next == null) {
            return false;
        }

        try {
            PixelGrid image = codec.decode(next.path());
            decodes++;

            Color3f color;
            if (next.knownColor() != null) {
                color = next.knownColor();
                cacheHits++;
            } else {
                color = ColorSpaces.meanLinear(image);
                colorsComputed++;
            }

            PixelGrid pixels = tileSize == null ? null : PixelGrids.resize(image, tileSize.width(), tileSize.height());
            tiles.add(new Tile(next.id(), color, pixels));
        } catch (DecodeFailureException | IllegalArgumentException e) {
            failures.add(TileFailure.of(next, e));
            logger.warn("Skipping tile {}: {}", next.path(), e.getMessage());
        }
        return true;
    }

    /**
     * Processes every remaining file.
     */
    public void processAll() {
        int before = remaining.size();
        while (processOne()) {
            // keep going until exhausted
        }
        logger.debug("Chunk {} done: {} files, {} tiles, {} failures", index, before, tiles.size(), failures.size());
    }

    public boolean isExhausted() {
        return remaining.isEmpty();
    }

    /**
     * @return number of files still to be processed
     */
    public int remaining() {
        return remaining.size();
    }

    public int index() {
        return index;
    }

    public List<Tile> tiles() {
        return Collections.unmodifiableList(tiles);
    }

    public List<TileFailure> failures() {
        return Collections.unmodifiableList(failures);
    }

    int colorsComputed() {
        return colorsComputed;
    }

    int cacheHits() {
        return cacheHits;
    }

    int decodes() {
        return decodes;
    }

    DictionaryHandle origin() {
        return origin;
    }
}
