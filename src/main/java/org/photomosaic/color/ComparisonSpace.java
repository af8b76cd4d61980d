package org.photomosaic.color;

import org.photomosaic.model.Color3f;

import java.util.Locale;

/**
 * Coordinate system in which tile colors are compared.
 * Conversion is only used for matching; tiles always keep their native pixels.
 */
public enum ComparisonSpace {

    /** Linear RGB, each channel in [0, 1]. */
    LINEAR_RGB {
        @Override
        public Color3f fromLinear(Color3f linear) {
            return linear;
        }

        @Override
        public boolean isRepresentable(Color3f color) {
            return color.isFinite() && color.within(-EPSILON, 1f + EPSILON);
        }
    },

    /** CIELAB with a D65 white point: L* in [0, 100], a* and b* in [-128, 128]. */
    CIELAB {
        @Override
        public Color3f fromLinear(Color3f linear) {
            return ColorSpaces.linearToLab(linear);
        }

        @Override
        public boolean isRepresentable(Color3f color) {
            return color.isFinite()
                    && color.c0() >= -EPSILON && color.c0() <= 100f + EPSILON
                    && color.c1() >= -128f && color.c1() <= 128f
                    && color.c2() >= -128f && color.c2() <= 128f;
        }
    };

    private static final float EPSILON = 1e-3f;

    /**
     * Re-expresses a linear RGB color in this space.
     */
    public abstract Color3f fromLinear(Color3f linear);

    /**
     * @return true if the channels are finite and inside the valid range of this space
     */
    public abstract boolean isRepresentable(Color3f color);

    /**
     * Lenient lookup used by configuration: case, spaces, dashes and underscores are ignored.
     */
    public static ComparisonSpace parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("comparison space must be non-empty");
        }
        String key = raw.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        for (ComparisonSpace space : values()) {
            if (space.name().toLowerCase(Locale.ROOT).replace("_", "").equals(key)) {
                return space;
            }
        }
        if (key.equals("lab")) {
            return CIELAB;
        }
        if (key.equals("rgb") || key.equals("linear")) {
            return LINEAR_RGB;
        }
        throw new IllegalArgumentException("Unknown comparison space: " + raw);
    }
}
