package org.photomosaic.model;

/**
 * A rectangular grid of RGB pixels.
 * <p>
 * The dictionary builder and the compositor are written against this capability only,
 * so a grid can be backed by an in-memory buffer ({@link RgbPixelGrid}) or by an
 * externally owned raster ({@link RasterPixelGrid}).
 * Pixels are packed as {@code 0xRRGGBB}; any alpha bits are ignored.
 */
public interface PixelGrid {

    int width();

    int height();

    /**
     * @return the pixel at (x, y) packed as 0xRRGGBB
     * @throws IndexOutOfBoundsException if (x, y) is outside the grid
     */
    int getRgb(int x, int y);

    /**
     * Writes the pixel at (x, y).
     *
     * @throws IndexOutOfBoundsException if (x, y) is outside the grid
     */
    void setRgb(int x, int y, int rgb);

    default long pixelCount() {
        return (long) width() * height();
    }

    /**
     * Copies the whole source grid so that its top-left corner lands on (x, y).
     *
     * @throws IndexOutOfBoundsException if the source does not fit
     */
    default void paste(PixelGrid source, int x, int y) {
        if (x < 0 || y < 0 || x + source.width() > width() || y + source.height() > height()) {
            throw new IndexOutOfBoundsException(
                    "Cannot paste " + source.width() + "x" + source.height() + " at (" + x + ", " + y
                            + ") into " + width() + "x" + height());
        }
        for (int sy = 0; sy < source.height(); sy++) {
            for (int sx = 0; sx < source.width(); sx++) {
                setRgb(x + sx, y + sy, source.getRgb(sx, sy));
            }
        }
    }

    /**
     * Returns a view of the rectangle (x, y, w, h). Reads and writes through the view hit this grid,
     * but the view refuses any coordinate outside its own rectangle.
     */
    default PixelGrid region(int x, int y, int w, int h) {
        return new PixelRegion(this, x, y, w, h);
    }

    /**
     * Visits every pixel row by row.
     */
    default void forEachPixel(PixelVisitor visitor) {
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                visitor.visit(x, y, getRgb(x, y));
            }
        }
    }

    @FunctionalInterface
    interface PixelVisitor {
        void visit(int x, int y, int rgb);
    }
}
