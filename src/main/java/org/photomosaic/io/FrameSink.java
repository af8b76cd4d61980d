package org.photomosaic.io;

import org.photomosaic.model.PixelGrid;

/**
 * Append-only destination for composed frames.
 */
public interface FrameSink extends AutoCloseable {

    /**
     * @throws org.photomosaic.error.EncodeFailureException if the frame cannot be written
     */
    void append(PixelGrid frame);

    /**
     * @return number of frames appended so far
     */
    int frameCount();

    @Override
    void close();
}
