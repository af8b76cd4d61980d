package org.photomosaic.model;

import java.util.Objects;

/**
 * A bounded window over another grid. Coordinates are relative to the window origin.
 */
public final class PixelRegion implements PixelGrid {

    private final PixelGrid backing;
    private final int originX;
    private final int originY;
    private final int width;
    private final int height;

    public PixelRegion(PixelGrid backing, int x, int y, int width, int height) {
        this.backing = Objects.requireNonNull(backing, "backing must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Region size must be non-negative: " + width + "x" + height);
        }
        if (x < 0 || y < 0 || x + width > backing.width() || y + height > backing.height()) {
            throw new IndexOutOfBoundsException(
                    "Region (" + x + ", " + y + ", " + width + "x" + height + ") exceeds "
                            + backing.width() + "x" + backing.height());
        }
        this.originX = x;
        this.originY = y;
        this.width = width;
        this.height = height;
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
        check(x, y);
        return backing.getRgb(originX + x, originY + y);
    }

    @Override
    public void setRgb(int x, int y, int rgb) {
        check(x, y);
        backing.setRgb(originX + x, originY + y, rgb);
    }

    @Override
    public PixelGrid region(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || x + w > width || y + h > height) {
            throw new IndexOutOfBoundsException(
                    "Region (" + x + ", " + y + ", " + w + "x" + h + ") exceeds " + width + "x" + height);
        }
        return new PixelRegion(backing, originX + x, originY + y, w, h);
    }

    @Override
    public void paste(PixelGrid source, int x, int y) {
        if (x < 0 || y < 0 || x + source.width() > width || y + source.height() > height) {
            throw new IndexOutOfBoundsException(
                    "Cannot paste " + source.width() + "x" + source.height() + " at (" + x + ", " + y
                            + ") into region " + width + "x" + height);
        }
        backing.paste(source, originX + x, originY + y);
    }

    private void check(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside region " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "PixelRegion(" + originX + ", " + originY + ", " + width + "x" + height + ")";
    }
}
