package org.photomosaic.dictionary;

/**
 * Counters of one dictionary build.
 *
 * @param cacheHits      tiles whose color came from the cache
 * @param colorsComputed tiles whose color was computed from pixels
 * @param decodes        tile files decoded (for colors, pixels or both)
 * @param failures       tiles skipped because they could not be decoded
 * @param pruned         cache entries dropped because their file is gone
 */
public record DictionaryStats(int cacheHits, int colorsComputed, int decodes, int failures, int pruned) {
}
