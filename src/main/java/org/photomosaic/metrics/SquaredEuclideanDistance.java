package org.photomosaic.metrics;

import org.photomosaic.model.Color3f;

/**
 * Squared Euclidean (L2) distance: sum_i (a_i - b_i)^2.
 */
public final class SquaredEuclideanDistance implements ColorMetric {

    @Override
    public double distance2(Color3f a, Color3f b) {
        requireNonNull(a, "a");
        requireNonNull(b, "b");

        double d0 = (double) a.c0() - b.c0();
        double d1 = (double) a.c1() - b.c1();
        double d2 = (double) a.c2() - b.c2();
        return d0 * d0 + d1 * d1 + d2 * d2;
    }

    @Override
    public String name() {
        return "squared-euclidean";
    }

    @Override
    public String toString() {
        return name();
    }

    private static void requireNonNull(Object x, String paramName) {
        if (x == null) {
            throw new IllegalArgumentException(paramName + " must not be null");
        }
    }
}
