package org.photomosaic.metrics;

import org.photomosaic.color.ColorSpaces;
import org.photomosaic.color.ComparisonSpace;
import org.photomosaic.error.EmptyDictionaryException;
import org.photomosaic.error.InconsistentTileSizeException;
import org.photomosaic.model.Color3f;
import org.photomosaic.model.PixelGrid;
import org.photomosaic.model.Tile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, read-only collection of tiles answering nearest-color queries.
 * <p>
 * Queries scan every tile (O(n)); the index is small enough that a linear scan is the
 * simplest correct baseline. Ties keep the first tile in index order, so results are
 * deterministic for a fixed ordering. The index is safe to share between threads.
 */
public final class ColorIndex {

    private final List<Tile> tiles;
    private final List<Color3f> keys;
    private final ComparisonSpace space;
    private final ColorMetric metric;
    private final int tileWidth;
    private final int tileHeight;

    /**
     * @param tiles  tiles in index order (non-null, non-empty)
     * @param space  space the tile colors are compared in (non-null)
     * @param metric distance strategy (non-null)
     * @throws EmptyDictionaryException      if there are no tiles
     * @throws InconsistentTileSizeException if the pixel buffers do not all share one size
     */
    public ColorIndex(List<Tile> tiles, ComparisonSpace space, ColorMetric metric) {
        Objects.requireNonNull(tiles, "tiles must not be null");
        this.space = Objects.requireNonNull(space, "space must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (tiles.isEmpty()) {
            throw new EmptyDictionaryException(null);
        }
        this.tiles = List.copyOf(tiles);

        PixelGrid first = this.tiles.get(0).pixels().orElse(null);
        this.tileWidth = first == null ? 0 : first.width();
        this.tileHeight = first == null ? 0 : first.height();

        List<Color3f> converted = new ArrayList<>(this.tiles.size());
        for (Tile tile : this.tiles) {
            PixelGrid px = tile.pixels().orElse(null);
            int w = px == null ? 0 : px.width();
            int h = px == null ? 0 : px.height();
            if (w != tileWidth || h != tileHeight) {
                throw new InconsistentTileSizeException(tile.id(), tileWidth, tileHeight, w, h);
            }
            converted.add(space.fromLinear(tile.color()));
        }
        this.keys = List.copyOf(converted);
    }

    public ColorIndex(List<Tile> tiles) {
        this(tiles, ComparisonSpace.CIELAB, new SquaredEuclideanDistance());
    }

    /**
     * Returns the tile whose comparison-space color is closest to the query.
     *
     * @param query a color already expressed in {@link #space()}
     */
    public Tile closest(Color3f query) {
        return closestMatch(query).tile();
    }

    /**
     * Same as {@link #closest(Color3f)} but also reports the winning score.
     */
    public Match closestMatch(Color3f query) {
        if (query == null) throw new IllegalArgumentException("query must not be null");

        int best = 0;
        double bestScore = metric.distance2(query, keys.get(0));
        for (int i = 1; i < keys.size(); i++) {
            double score = metric.distance2(query, keys.get(i));
            // strict: the first tile in scan order wins ties
            if (score < bestScore) {
                bestScore = score;
                best = i;
            }
        }
        return new Match(tiles.get(best), bestScore);
    }

    /**
     * Closest tile for a packed 0xRRGGBB sRGB pixel.
     */
    public Tile closestToPixel(int rgb) {
        return closest(toComparisonSpace(ColorSpaces.toLinear(rgb)));
    }

    /**
     * Re-expresses a linear RGB color in the comparison space of this index.
     */
    public Color3f toComparisonSpace(Color3f linear) {
        return space.fromLinear(linear);
    }

    /**
     * @return the comparison-space color of every tile, in index order
     */
    public List<Color3f> comparisonColors() {
        return keys;
    }

    public List<Tile> tiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    public Optional<Tile> find(String id) {
        return tiles.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    /**
     * @return true if every tile carries a pixel buffer (compose mode)
     */
    public boolean hasPixels() {
        return tileWidth > 0 && tileHeight > 0;
    }

    public int tileWidth() {
        return tileWidth;
    }

    public int tileHeight() {
        return tileHeight;
    }

    public ComparisonSpace space() {
        return space;
    }

    public ColorMetric metric() {
        return metric;
    }
}
