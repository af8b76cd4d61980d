package org.photomosaic.model;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Arrays;

/**
 * In-memory pixel grid backed by one packed {@code int[]} (row-major, 0xRRGGBB).
 */
public final class RgbPixelGrid implements PixelGrid {

    private final int width;
    private final int height;
    private final int[] pixels;

    public RgbPixelGrid(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid size must be non-negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = new int[Math.multiplyExact(width, height)];
    }

    /**
     * Copies a decoded image into a new in-memory grid.
     * <p>
     * Alpha is dropped, never composited: a transparent pixel keeps its stored color.
     * Gray images are read from the raw samples, each replicated into the three channels,
     * so a gray level of 128 becomes 0x808080 whatever the image color space says.
     */
    public static RgbPixelGrid copyOf(BufferedImage image) {
        RgbPixelGrid grid = new RgbPixelGrid(image.getWidth(), image.getHeight());
        if (grid.pixels.length == 0) {
            return grid;
        }
        if (isGray(image)) {
            Raster raster = image.getRaster();
            int max = grayMax(image);
            for (int y = 0; y < grid.height; y++) {
                for (int x = 0; x < grid.width; x++) {
                    grid.pixels[y * grid.width + x] = grayRgb(raster.getSample(x, y, 0), max);
                }
            }
            return grid;
        }
        image.getRGB(0, 0, grid.width, grid.height, grid.pixels, 0, grid.width);
        for (int i = 0; i < grid.pixels.length; i++) {
            grid.pixels[i] &= 0xFFFFFF;
        }
        return grid;
    }

    static boolean isGray(BufferedImage image) {
        ColorModel model = image.getColorModel();
        return !(model instanceof IndexColorModel) && model.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    static int grayMax(BufferedImage image) {
        return (1 << image.getColorModel().getComponentSize(0)) - 1;
    }

    /**
     * Packs a gray sample of the given bit depth as 0xRRGGBB.
     */
    static int grayRgb(int sample, int max) {
        int v = max == 0xFF ? sample : (int) Math.round(sample * 255.0 / max);
        return (v << 16) | (v << 8) | v;
    }

    /**
     * Creates a grid filled with one color.
     */
    public static RgbPixelGrid filled(int width, int height, int rgb) {
        RgbPixelGrid grid = new RgbPixelGrid(width, height);
        Arrays.fill(grid.pixels, rgb & 0xFFFFFF);
        return grid;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int getRgb(int x, int y) {
        return pixels[index(x, y)];
    }

    @Override
    public void setRgb(int x, int y, int rgb) {
        pixels[index(x, y)] = rgb & 0xFFFFFF;
    }

    @Override
    public void paste(PixelGrid source, int x, int y) {
        if (!(source instanceof RgbPixelGrid src)) {
            PixelGrid.super.paste(source, x, y);
            return;
        }
        if (x < 0 || y < 0 || x + src.width > width || y + src.height > height) {
            throw new IndexOutOfBoundsException(
                    "Cannot paste " + src.width + "x" + src.height + " at (" + x + ", " + y
                            + ") into " + width + "x" + height);
        }
        for (int row = 0; row < src.height; row++) {
            System.arraycopy(src.pixels, row * src.width, pixels, (y + row) * width + x, src.width);
        }
    }

    /**
     * Renders the grid into a fresh {@code TYPE_INT_RGB} image for encoding.
     */
    public BufferedImage toImage() {
        if (pixels.length == 0) {
            throw new IllegalStateException("Cannot render an empty " + width + "x" + height + " grid");
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    private int index(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    @Override
    public String toString() {
        return "RgbPixelGrid(" + width + "x" + height + ")";
    }
}
