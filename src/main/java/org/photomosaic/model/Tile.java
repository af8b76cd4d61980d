package org.photomosaic.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One dictionary entry: a stable identity (path relative to the tile source),
 * its representative color in linear RGB and, in compose mode, its resized pixels.
 */
public final class Tile {

    private final String id;
    private final Color3f color;
    private final PixelGrid pixels;

    public Tile(String id, Color3f color, PixelGrid pixels) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-empty");
        }
        this.id = id;
        this.color = Objects.requireNonNull(color, "color must not be null");
        this.pixels = pixels;
    }

    public Tile(String id, Color3f color) {
        this(id, color, null);
    }

    public String id() {
        return id;
    }

    public Color3f color() {
        return color;
    }

    public Optional<PixelGrid> pixels() {
        return Optional.ofNullable(pixels);
    }

    /**
     * Returns the pixels or throws if this tile was built without them.
     */
    public PixelGrid requirePixels() {
        if (pixels == null) {
            throw new IllegalStateException("Tile has no pixel buffer: " + id);
        }
        return pixels;
    }

    @Override
    public String toString() {
        return "Tile(" + id + ", " + color + ")";
    }
}
