package org.photomosaic.metrics;

import org.photomosaic.model.Color3f;

/**
 * Strategy interface for comparing two colors of the same comparison space.
 * Implementations must define a score where "smaller = closer".
 */
public interface ColorMetric {

    /**
     * Computes a monotonic distance score between two colors.
     * No square root needs to be taken: only the ordering of scores matters for matching.
     *
     * @param a first color (non-null)
     * @param b second color (non-null)
     * @return a non-negative score, where smaller means more similar
     * @throws IllegalArgumentException if a color is null
     */
    double distance2(Color3f a, Color3f b);

    /**
     * @return a human-readable name for the metric (useful for logging).
     */
    String name();
}
