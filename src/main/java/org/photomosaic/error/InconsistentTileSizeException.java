package org.photomosaic.error;

/**
 * A tile pixel buffer does not match the tile size shared by the whole dictionary.
 */
public class InconsistentTileSizeException extends MosaicException {

    public InconsistentTileSizeException(String tileId, int expectedWidth, int expectedHeight,
                                         int actualWidth, int actualHeight) {
        super("Tile '" + tileId + "' is " + actualWidth + "x" + actualHeight
                + " but the dictionary tile size is " + expectedWidth + "x" + expectedHeight, null);
    }
}
