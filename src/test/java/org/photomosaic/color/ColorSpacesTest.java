package org.photomosaic.color;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.photomosaic.model.Color3f;
import org.photomosaic.model.RgbPixelGrid;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorSpacesTest {

    private static final double EPS = 1e-6;

    private static void assertColor(Color3f expected, Color3f actual, double delta) {
        assertEquals(expected.c0(), actual.c0(), delta, "channel 0 of " + actual);
        assertEquals(expected.c1(), actual.c1(), delta, "channel 1 of " + actual);
        assertEquals(expected.c2(), actual.c2(), delta, "channel 2 of " + actual);
    }

    @Nested
    class Linearization {

        @Test
        void toLinear_blackAndWhite_mapToRangeEnds() {
            assertEquals(new Color3f(0f, 0f, 0f), ColorSpaces.toLinear(0x000000));
            assertEquals(new Color3f(1f, 1f, 1f), ColorSpaces.toLinear(0xFFFFFF));
        }

        @Test
        void toLinear_midGray_isDarkerThanHalf() {
            // sRGB 128 is about 0.2158 in linear light
            Color3f c = ColorSpaces.toLinear(0x808080);
            assertEquals(0.2158, c.c0(), 1e-3);
            assertEquals(c.c0(), c.c1());
            assertEquals(c.c1(), c.c2());
        }

        @Test
        void toLinear_ignoresAlphaBits() {
            assertEquals(ColorSpaces.toLinear(0x123456), ColorSpaces.toLinear(0xFF123456));
        }

        @Test
        void fromLinear_invertsToLinear_forEveryByte() {
            for (int v = 0; v < 256; v++) {
                int rgb = (v << 16) | ((255 - v) << 8) | (v / 2);
                assertEquals(rgb, ColorSpaces.fromLinear(ColorSpaces.toLinear(rgb)), "value " + v);
            }
        }

        @Test
        void fromLinear_clampsOutOfGamut() {
            assertEquals(0xFF0000, ColorSpaces.fromLinear(new Color3f(2f, -1f, 0f)));
        }
    }

    @Nested
    class Lab {

        @Test
        void white_isL100_neutral() {
            Color3f lab = ColorSpaces.linearToLab(new Color3f(1f, 1f, 1f));
            assertEquals(100.0, lab.c0(), 1e-2);
            assertEquals(0.0, lab.c1(), 1e-2);
            assertEquals(0.0, lab.c2(), 1e-2);
        }

        @Test
        void black_isOrigin() {
            assertColor(new Color3f(0f, 0f, 0f), ColorSpaces.linearToLab(new Color3f(0f, 0f, 0f)), 1e-4);
        }

        @Test
        void red_hasPositiveA() {
            Color3f lab = ColorSpaces.linearToLab(ColorSpaces.toLinear(0xFF0000));
            assertEquals(53.24, lab.c0(), 0.1);
            assertTrue(lab.c1() > 70);
        }
    }

    @Nested
    class Mean {

        @Test
        void mean_ofUniformColors_returnsThatColor() {
            Color3f c = ColorSpaces.toLinear(0x3366CC);
            List<Color3f> samples = new ArrayList<>();
            for (int i = 0; i < 64; i++) samples.add(c);

            assertEquals(c, ColorSpaces.mean(samples));
        }

        @Test
        void mean_halfAHalfB_returnsMidpoint() {
            Color3f a = new Color3f(0.2f, 0.4f, 0.6f);
            Color3f b = new Color3f(0.6f, 0.0f, 1.0f);
            List<Color3f> samples = new ArrayList<>();
            for (int i = 0; i < 50; i++) samples.add(a);
            for (int i = 0; i < 50; i++) samples.add(b);

            assertColor(new Color3f(0.4f, 0.2f, 0.8f), ColorSpaces.mean(samples), EPS);
        }

        @Test
        void mean_empty_throws() {
            assertThrows(IllegalArgumentException.class, () -> ColorSpaces.mean(List.of()));
        }

        @Test
        void meanLinear_uniformGrid_returnsExactLinearColor() {
            RgbPixelGrid grid = RgbPixelGrid.filled(8, 8, 0x40A0E0);
            assertEquals(ColorSpaces.toLinear(0x40A0E0), ColorSpaces.meanLinear(grid));
        }

        @Test
        void meanLinear_blackWhiteSplit_averagesInLinearLight() {
            RgbPixelGrid grid = RgbPixelGrid.filled(4, 4, 0x000000);
            for (int y = 0; y < 4; y++) {
                for (int x = 2; x < 4; x++) grid.setRgb(x, y, 0xFFFFFF);
            }
            // 0.5 in linear light, not sRGB 128
            assertColor(new Color3f(0.5f, 0.5f, 0.5f), ColorSpaces.meanLinear(grid), EPS);
        }

        @Test
        void meanLinear_emptyGrid_throws() {
            assertThrows(IllegalArgumentException.class, () -> ColorSpaces.meanLinear(new RgbPixelGrid(0, 3)));
        }
    }

    @Nested
    class Accumulator {

        @Test
        void total_mustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new MeanAccumulator(0));
        }

        @Test
        void mean_beforeAllSamples_throws() {
            MeanAccumulator acc = new MeanAccumulator(3);
            acc.add(new Color3f(1f, 1f, 1f));
            IllegalStateException ex = assertThrows(IllegalStateException.class, acc::mean);
            assertTrue(ex.getMessage().contains("only 1"));
        }

        @Test
        void add_beyondTotal_throws() {
            MeanAccumulator acc = new MeanAccumulator(1);
            acc.add(0.1, 0.2, 0.3);
            assertThrows(IllegalStateException.class, () -> acc.add(0.1, 0.2, 0.3));
            assertEquals(1, acc.added());
        }

        @Test
        void largeCount_staysStable() {
            int n = 1_000_000;
            MeanAccumulator acc = new MeanAccumulator(n);
            for (int i = 0; i < n; i++) {
                acc.add(i % 2 == 0 ? 0.25 : 0.75, 0.5, 1.0);
            }
            assertColor(new Color3f(0.5f, 0.5f, 1.0f), acc.mean(), 1e-5);
        }
    }

    @Nested
    class Spaces {

        @Test
        void linearRgb_isIdentity() {
            Color3f c = new Color3f(0.1f, 0.2f, 0.3f);
            assertSame(c, ComparisonSpace.LINEAR_RGB.fromLinear(c));
        }

        @Test
        void representable_checksRange() {
            assertTrue(ComparisonSpace.LINEAR_RGB.isRepresentable(new Color3f(0f, 0.5f, 1f)));
            assertFalse(ComparisonSpace.LINEAR_RGB.isRepresentable(new Color3f(0f, 1.5f, 1f)));
            assertFalse(ComparisonSpace.LINEAR_RGB.isRepresentable(new Color3f(Float.NaN, 0f, 0f)));

            assertTrue(ComparisonSpace.CIELAB.isRepresentable(new Color3f(50f, -20f, 90f)));
            assertFalse(ComparisonSpace.CIELAB.isRepresentable(new Color3f(120f, 0f, 0f)));
        }

        @Test
        void parse_isLenient() {
            assertEquals(ComparisonSpace.CIELAB, ComparisonSpace.parse(" cielab "));
            assertEquals(ComparisonSpace.CIELAB, ComparisonSpace.parse("Lab"));
            assertEquals(ComparisonSpace.LINEAR_RGB, ComparisonSpace.parse("linear-rgb"));
            assertEquals(ComparisonSpace.LINEAR_RGB, ComparisonSpace.parse("LINEAR_RGB"));
            assertThrows(IllegalArgumentException.class, () -> ComparisonSpace.parse("hsv"));
            assertThrows(IllegalArgumentException.class, () -> ComparisonSpace.parse(" "));
        }
    }
}
