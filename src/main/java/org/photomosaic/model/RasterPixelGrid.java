package org.photomosaic.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Pixel grid over an externally owned {@link BufferedImage}, such as a decoded video frame.
 * No copy is made: reads and writes go straight to the image raster.
 * Reads follow {@link RgbPixelGrid#copyOf}: alpha is dropped and gray samples are replicated.
 */
public final class RasterPixelGrid implements PixelGrid {

    private final BufferedImage image;
    private final int grayMax;

    public RasterPixelGrid(BufferedImage image) {
        this.image = Objects.requireNonNull(image, "image must not be null");
        this.grayMax = RgbPixelGrid.isGray(image) ? RgbPixelGrid.grayMax(image) : 0;
    }

    @Override
    public int width() {
        return image.getWidth();
    }

    @Override
    public int height() {
        return image.getHeight();
    }

    @Override
    public int getRgb(int x, int y) {
        check(x, y);
        if (grayMax > 0) {
            return RgbPixelGrid.grayRgb(image.getRaster().getSample(x, y, 0), grayMax);
        }
        return image.getRGB(x, y) & 0xFFFFFF;
    }

    @Override
    public void setRgb(int x, int y, int rgb) {
        check(x, y);
        image.setRGB(x, y, 0xFF000000 | rgb);
    }

    /**
     * @return true if {@link PixelGrids#resize} can draw the image as is
     */
    boolean isOpaqueRgb() {
        return grayMax == 0 && image.getType() == BufferedImage.TYPE_INT_RGB;
    }

    public BufferedImage image() {
        return image;
    }

    private void check(int x, int y) {
        if (x < 0 || y < 0 || x >= image.getWidth() || y >= image.getHeight()) {
            throw new IndexOutOfBoundsException(
                    "(" + x + ", " + y + ") outside " + image.getWidth() + "x" + image.getHeight());
        }
    }

    @Override
    public String toString() {
        return "RasterPixelGrid(" + image.getWidth() + "x" + image.getHeight() + ")";
    }
}
