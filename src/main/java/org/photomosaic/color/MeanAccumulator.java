package org.photomosaic.color;

import org.photomosaic.model.Color3f;

/**
 * Running mean over a known number of samples.
 * <p>
 * Each sample contributes {@code value / total} to the accumulator, so no sample has to be
 * kept around and the partial sums stay in the same range as the colors themselves.
 * Sums are kept in double precision and only narrowed when the mean is emitted.
 */
public final class MeanAccumulator {

    private final long total;
    private final double weight;
    private long added;
    private double c0;
    private double c1;
    private double c2;

    public MeanAccumulator(long total) {
        if (total <= 0) {
            throw new IllegalArgumentException("total must be >= 1");
        }
        this.total = total;
        this.weight = 1.0 / total;
    }

    public void add(Color3f color) {
        add(color.c0(), color.c1(), color.c2());
    }

    public void add(double v0, double v1, double v2) {
        if (added == total) {
            throw new IllegalStateException("All " + total + " samples were already added");
        }
        c0 += v0 * weight;
        c1 += v1 * weight;
        c2 += v2 * weight;
        added++;
    }

    public long added() {
        return added;
    }

    /**
     * @throws IllegalStateException if fewer samples than announced were added
     */
    public Color3f mean() {
        if (added != total) {
            throw new IllegalStateException("Expected " + total + " samples but only " + added + " were added");
        }
        return Color3f.of(c0, c1, c2);
    }
}
