package org.photomosaic.io;

import org.photomosaic.model.PixelGrid;

import java.util.Optional;

/**
 * A lazy, finite, non-restartable sequence of frames.
 */
public interface FrameSource extends AutoCloseable {

    /**
     * @return frames per second
     */
    double frameRate();

    int width();

    int height();

    /**
     * Pulls the next frame. The returned grid belongs to the caller.
     *
     * @return the next frame, or empty once the sequence is exhausted
     * @throws org.photomosaic.error.DecodeFailureException if a frame cannot be decoded
     */
    Optional<PixelGrid> nextFrame();

    @Override
    void close();
}
