package org.photomosaic.app;

/**
 * Size the target image is resized to before composition.
 */
public record TargetDimensions(int width, int height) {

    public TargetDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must be non-negative: " + width + "x" + height);
        }
    }

    /**
     * Resolves the requested size against the source size.
     * With only one side given, the other keeps the source aspect ratio (truncated, at least 1).
     * With neither, the source size is kept.
     *
     * @param width  requested width or null
     * @param height requested height or null
     */
    public static TargetDimensions resolve(Integer width, Integer height, int sourceWidth, int sourceHeight) {
        if (width != null && width <= 0) throw new IllegalArgumentException("width must be >= 1");
        if (height != null && height <= 0) throw new IllegalArgumentException("height must be >= 1");

        if (width != null && height != null) {
            return new TargetDimensions(width, height);
        }
        if (sourceWidth == 0 || sourceHeight == 0) {
            return new TargetDimensions(sourceWidth, sourceHeight);
        }
        if (width != null) {
            int h = (int) (width * ((double) sourceHeight / sourceWidth));
            return new TargetDimensions(width, Math.max(1, h));
        }
        if (height != null) {
            int w = (int) (height * ((double) sourceWidth / sourceHeight));
            return new TargetDimensions(Math.max(1, w), height);
        }
        return new TargetDimensions(sourceWidth, sourceHeight);
    }

    public boolean matches(int w, int h) {
        return width == w && height == h;
    }
}
