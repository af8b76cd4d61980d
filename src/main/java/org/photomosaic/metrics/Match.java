package org.photomosaic.metrics;

import org.photomosaic.model.Tile;

/**
 * A simple immutable result: the winning tile with its score against the query.
 */
public record Match(Tile tile, double distance2) {
}
