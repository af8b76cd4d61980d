package org.photomosaic.app.api.dto;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One mosaic run as asked for by a caller.
 *
 * @param target     target image (or animated GIF in video mode)
 * @param dictionary tile source directory
 * @param output     output image file (or frame directory in video mode)
 * @param width      requested target width in tiles, or null
 * @param height     requested target height in tiles, or null
 * @param tilePixels side of the square tiles in pixels
 * @param video      treat the target as a sequence of frames
 */
public record MosaicRequest(Path target, Path dictionary, Path output,
                            Integer width, Integer height, int tilePixels, boolean video) {

    public MosaicRequest {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(dictionary, "dictionary must not be null");
        Objects.requireNonNull(output, "output must not be null");
        if (width != null && width <= 0) throw new IllegalArgumentException("width must be >= 1");
        if (height != null && height <= 0) throw new IllegalArgumentException("height must be >= 1");
        if (tilePixels <= 0) throw new IllegalArgumentException("tilePixels must be >= 1");
    }
}
