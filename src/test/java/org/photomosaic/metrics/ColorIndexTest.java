package org.photomosaic.metrics;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.photomosaic.color.ColorSpaces;
import org.photomosaic.color.ComparisonSpace;
import org.photomosaic.error.EmptyDictionaryException;
import org.photomosaic.error.InconsistentTileSizeException;
import org.photomosaic.model.Color3f;
import org.photomosaic.model.RgbPixelGrid;
import org.photomosaic.model.Tile;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorIndexTest {

    private static Tile tile(String id, int rgb) {
        return new Tile(id, ColorSpaces.toLinear(rgb));
    }

    private static Tile tileWithPixels(String id, int rgb, int w, int h) {
        return new Tile(id, ColorSpaces.toLinear(rgb), RgbPixelGrid.filled(w, h, rgb));
    }

    @Nested
    class Metric {

        private final ColorMetric metric = new SquaredEuclideanDistance();

        @Test
        void distance_isSquared() {
            assertEquals(25.0, metric.distance2(new Color3f(0f, 0f, 0f), new Color3f(3f, 4f, 0f)), 1e-12);
        }

        @Test
        void distance_toSelf_isZero() {
            Color3f c = new Color3f(0.3f, 0.6f, 0.9f);
            assertEquals(0.0, metric.distance2(c, c));
        }

        @Test
        void null_throws() {
            assertThrows(IllegalArgumentException.class, () -> metric.distance2(null, new Color3f(0f, 0f, 0f)));
        }
    }

    @Nested
    class Construction {

        @Test
        void empty_throws() {
            assertThrows(EmptyDictionaryException.class, () -> new ColorIndex(List.of()));
        }

        @Test
        void mixedPixelSizes_throw() {
            List<Tile> tiles = List.of(tileWithPixels("a", 0xFF0000, 4, 4), tileWithPixels("b", 0x00FF00, 4, 3));
            InconsistentTileSizeException e =
                    assertThrows(InconsistentTileSizeException.class, () -> new ColorIndex(tiles));
            assertTrue(e.getMessage().contains("b"));
        }

        @Test
        void someTilesWithoutPixels_throw() {
            List<Tile> tiles = List.of(tile("a", 0xFF0000), tileWithPixels("b", 0x00FF00, 4, 4));
            assertThrows(InconsistentTileSizeException.class, () -> new ColorIndex(tiles));
        }

        @Test
        void colorsOnly_hasNoPixels() {
            ColorIndex index = new ColorIndex(List.of(tile("a", 0xFF0000)));
            assertFalse(index.hasPixels());
            assertEquals(0, index.tileWidth());
        }

        @Test
        void withPixels_reportsTileSize() {
            ColorIndex index = new ColorIndex(List.of(tileWithPixels("a", 0xFF0000, 6, 5)));
            assertTrue(index.hasPixels());
            assertEquals(6, index.tileWidth());
            assertEquals(5, index.tileHeight());
        }

        @Test
        void defaultSpace_isLab() {
            ColorIndex index = new ColorIndex(List.of(tile("white", 0xFFFFFF)));
            assertEquals(ComparisonSpace.CIELAB, index.space());
            assertEquals(100f, index.comparisonColors().get(0).c0(), 0.05f);
        }
    }

    @Nested
    class Queries {

        private final ColorIndex index = new ColorIndex(List.of(
                tile("red", 0xFF0000),
                tile("green", 0x00FF00),
                tile("blue", 0x0000FF),
                tile("gray", 0x808080)));

        @Test
        void exactColor_returnsThatTile() {
            for (Tile t : index.tiles()) {
                Match match = index.closestMatch(index.toComparisonSpace(t.color()));
                assertEquals(t.id(), match.tile().id());
                assertEquals(0.0, match.distance2(), 1e-9);
            }
        }

        @Test
        void closestToPixel_picksNearestHue() {
            assertEquals("red", index.closestToPixel(0xE01010).id());
            assertEquals("blue", index.closestToPixel(0x1010D0).id());
            assertEquals("gray", index.closestToPixel(0x7A7A7A).id());
        }

        @Test
        void ties_goToFirstTile() {
            ColorIndex twins = new ColorIndex(List.of(
                    tile("first", 0x336699),
                    tile("second", 0x336699)));
            assertEquals("first", twins.closestToPixel(0x336699).id());
            assertEquals("first", twins.closestToPixel(0x000000).id());
        }

        @Test
        void linearSpace_comparesLinearValues() {
            ColorIndex linear = new ColorIndex(
                    List.of(tile("black", 0x000000), tile("white", 0xFFFFFF)),
                    ComparisonSpace.LINEAR_RGB, new SquaredEuclideanDistance());
            // sRGB 0x9C is about 0.33 linear, closer to black
            assertEquals("black", linear.closestToPixel(0x9C9C9C).id());
            assertEquals(linear.tiles().get(1).color(), linear.comparisonColors().get(1));
        }

        @Test
        void nullQuery_throws() {
            assertThrows(IllegalArgumentException.class, () -> index.closest(null));
        }

        @Test
        void find_byId() {
            assertTrue(index.find("green").isPresent());
            assertTrue(index.find("purple").isEmpty());
            assertEquals(4, index.size());
        }

        @Test
        void tiles_areReadOnly() {
            assertThrows(UnsupportedOperationException.class, () -> index.tiles().add(tile("x", 0)));
        }
    }
}
