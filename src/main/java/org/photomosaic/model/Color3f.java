package org.photomosaic.model;

import java.util.Arrays;

/**
 * An immutable three channel color with float components.
 * The color space is decided by whoever produced the value (linear RGB, CIELAB, ...).
 */
public final class Color3f {

    public static final int CHANNELS = 3;

    private final float[] data;

    public Color3f(float c0, float c1, float c2) {
        this.data = new float[]{c0, c1, c2};
    }

    /**
     * Builds a color from an array of exactly three values.
     * The input array is copied to keep immutability.
     */
    public static Color3f of(float[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length != CHANNELS) {
            throw new IllegalArgumentException("A color needs " + CHANNELS + " channels but got " + values.length);
        }
        return new Color3f(values[0], values[1], values[2]);
    }

    public static Color3f of(double c0, double c1, double c2) {
        return new Color3f((float) c0, (float) c1, (float) c2);
    }

    /**
     * Returns the value of the given channel.
     *
     * @throws IndexOutOfBoundsException if the channel index is invalid
     */
    public float get(int channel) {
        if (channel < 0 || channel >= CHANNELS) {
            throw new IndexOutOfBoundsException("channel=" + channel + ", channels=" + CHANNELS);
        }
        return data[channel];
    }

    public float c0() {
        return data[0];
    }

    public float c1() {
        return data[1];
    }

    public float c2() {
        return data[2];
    }

    /**
     * Returns a copy of the channels.
     */
    public float[] toArrayCopy() {
        return Arrays.copyOf(data, CHANNELS);
    }

    /**
     * @return true when no channel is NaN or infinite
     */
    public boolean isFinite() {
        for (float v : data) {
            if (!Float.isFinite(v)) return false;
        }
        return true;
    }

    /**
     * @return true when every channel lies in the closed range [min, max]
     */
    public boolean within(float min, float max) {
        for (float v : data) {
            if (v < min || v > max) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Color3f(" + data[0] + ", " + data[1] + ", " + data[2] + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Color3f other = (Color3f) obj;
        return Arrays.equals(this.data, other.data);
    }
}
