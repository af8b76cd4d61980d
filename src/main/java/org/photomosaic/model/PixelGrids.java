package org.photomosaic.model;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Conversions and resampling shared by the dictionary builder and the target preparation.
 */
public final class PixelGrids {

    private PixelGrids() {}

    /**
     * Returns a {@link BufferedImage} with the content of the grid, reusing the backing image when there is one.
     */
    public static BufferedImage toImage(PixelGrid grid) {
        if (grid instanceof RasterPixelGrid raster) {
            return raster.image();
        }
        if (grid instanceof RgbPixelGrid rgb) {
            return rgb.toImage();
        }
        if (grid.pixelCount() == 0) {
            throw new IllegalStateException("Cannot render an empty " + grid.width() + "x" + grid.height() + " grid");
        }
        BufferedImage image = new BufferedImage(grid.width(), grid.height(), BufferedImage.TYPE_INT_RGB);
        grid.forEachPixel((x, y, rgb) -> image.setRGB(x, y, rgb));
        return image;
    }

    /**
     * Resamples the grid to exactly width x height with bicubic interpolation.
     * The result is always a fresh in-memory grid; a grid that already has the requested size is copied as is.
     * Both paths read the same 0xRRGGBB values: alpha is ignored, never blended.
     */
    public static RgbPixelGrid resize(PixelGrid source, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        if (source.pixelCount() == 0) {
            throw new IllegalArgumentException("Cannot resize an empty grid");
        }
        if (source.width() == width && source.height() == height) {
            RgbPixelGrid copy = new RgbPixelGrid(width, height);
            copy.paste(source, 0, 0);
            return copy;
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(opaque(source), 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return RgbPixelGrid.copyOf(out);
    }

    /**
     * The source as a {@code TYPE_INT_RGB} image holding exactly what {@link PixelGrid#getRgb} reads,
     * so drawing it never composites alpha or converts gray.
     */
    private static BufferedImage opaque(PixelGrid source) {
        if (source instanceof RasterPixelGrid raster) {
            return raster.isOpaqueRgb() ? raster.image() : RgbPixelGrid.copyOf(raster.image()).toImage();
        }
        return toImage(source);
    }
}
