package org.photomosaic.model;

/**
 * Pixel size every tile is resized to for compositing.
 */
public record TileSize(int width, int height) {

    public TileSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + width + "x" + height);
        }
    }

    public static TileSize square(int pixels) {
        return new TileSize(pixels, pixels);
    }

    public boolean matches(PixelGrid grid) {
        return grid.width() == width && grid.height() == height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
