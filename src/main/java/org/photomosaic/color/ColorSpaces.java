package org.photomosaic.color;

import org.photomosaic.model.Color3f;
import org.photomosaic.model.PixelGrid;

import java.util.Collection;

/**
 * Color space conversions used for tile matching.
 * <p>
 * Pixels arrive as gamma encoded sRGB (8 bits per channel). Means are always taken in
 * linear RGB so that averaging does not bias towards dark tones; the CIELAB conversion
 * (D65 white point) is only used to compare colors.
 */
public final class ColorSpaces {

    private ColorSpaces() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final float[] LINEAR_LUT = new float[256];

    static {
        for (int i = 0; i < LINEAR_LUT.length; i++) {
            LINEAR_LUT[i] = (float) gammaExpand(i / 255.0);
        }
    }

    /**
     * Convert a packed 0xRRGGBB sRGB sample to linear RGB in [0, 1].
     */
    public static Color3f toLinear(int rgb) {
        return new Color3f(
                LINEAR_LUT[(rgb >> 16) & 0xFF],
                LINEAR_LUT[(rgb >> 8) & 0xFF],
                LINEAR_LUT[rgb & 0xFF]);
    }

    /**
     * Convert linear RGB back to a packed 0xRRGGBB sRGB sample, clamping out-of-gamut values.
     */
    public static int fromLinear(Color3f linear) {
        int r = encodeChannel(linear.c0());
        int g = encodeChannel(linear.c1());
        int b = encodeChannel(linear.c2());
        return (r << 16) | (g << 8) | b;
    }

    /**
     * Convert linear RGB to CIELAB [L*, a*, b*].
     */
    public static Color3f linearToLab(Color3f linear) {
        double rl = linear.c0();
        double gl = linear.c1();
        double bl = linear.c2();

        // Linear RGB -> XYZ (D65)
        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return Color3f.of(L, a, bStar);
    }

    /**
     * Arithmetic mean of a collection of colors.
     *
     * @throws IllegalArgumentException if the collection is empty
     */
    public static Color3f mean(Collection<Color3f> colors) {
        if (colors == null || colors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty set of colors");
        }
        MeanAccumulator acc = new MeanAccumulator(colors.size());
        for (Color3f c : colors) {
            acc.add(c);
        }
        return acc.mean();
    }

    /**
     * Representative color of a grid: the linear RGB mean of all its pixels.
     *
     * @throws IllegalArgumentException if the grid has no pixels
     */
    public static Color3f meanLinear(PixelGrid grid) {
        if (grid.pixelCount() == 0) {
            throw new IllegalArgumentException("Cannot average an empty " + grid.width() + "x" + grid.height() + " grid");
        }
        MeanAccumulator acc = new MeanAccumulator(grid.pixelCount());
        grid.forEachPixel((x, y, rgb) -> acc.add(
                LINEAR_LUT[(rgb >> 16) & 0xFF],
                LINEAR_LUT[(rgb >> 8) & 0xFF],
                LINEAR_LUT[rgb & 0xFF]));
        return acc.mean();
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double gammaCompress(double c) {
        return c <= 0.0031308 ? c * 12.92 : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    private static int encodeChannel(float linear) {
        double clamped = Math.min(1.0, Math.max(0.0, linear));
        return (int) Math.round(gammaCompress(clamped) * 255.0);
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : (903.3 * t + 16.0) / 116.0;
    }
}
