package org.photomosaic.io;

import org.photomosaic.error.DecodeFailureException;
import org.photomosaic.error.EncodeFailureException;
import org.photomosaic.model.PixelGrid;

import java.nio.file.Path;

/**
 * Image file decoding and encoding, as seen by the mosaic core.
 */
public interface ImageCodec {

    /**
     * Decodes the image at the given path.
     *
     * @throws DecodeFailureException if the file cannot be read or is not a supported image
     */
    PixelGrid decode(Path path);

    /**
     * Encodes the grid to the given path. The format follows the file extension.
     *
     * @throws EncodeFailureException if the grid cannot be written
     */
    void encode(PixelGrid grid, Path path);
}
