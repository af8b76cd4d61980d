package org.photomosaic.compose;

import org.photomosaic.model.PixelGrid;

/**
 * A run of target rows together with the canvas region those rows are drawn into.
 * The region is handed to exactly one worker.
 */
record CanvasBand(int firstRow, int endRow, PixelGrid region) {

    int rows() {
        return endRow - firstRow;
    }
}
