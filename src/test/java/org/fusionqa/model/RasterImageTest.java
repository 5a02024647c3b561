package org.fusionqa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RasterImageTest {

    /* ============================================================
       Helpers
       ============================================================ */

    private static final String CRS = "EPSG:32633";

    /** Grid whose upper-left corner sits at (0, height * scale). */
    private static RasterGrid grid(int width, int height, double scale) {
        return new RasterGrid(width, height, new Projection(CRS, scale, 0.0, height * scale));
    }

    private static RasterImage image2x2(String name, double... values) {
        return RasterImage.builder(grid(2, 2, 1.0)).band(name, values).build();
    }

    /* ============================================================
       Geometry
       ============================================================ */

    @Nested
    @DisplayName("Grid geometry")
    class Geometry {

        @Test
        void footprintAndPixelCentres() {
            RasterGrid g = grid(3, 2, 10.0);
            assertEquals(new Region(0.0, 0.0, 30.0, 20.0), g.footprint());
            assertEquals(6, g.pixelCount());
            assertEquals(5.0, g.projection().centreX(0), 1e-12);
            assertEquals(15.0, g.projection().centreY(0), 1e-12);
            assertEquals(0.0, g.projection().columnAt(5.0), 1e-12);
            assertEquals(1.0, g.projection().rowAt(5.0), 1e-12);
        }

        @Test
        void oversizedGridIsRejected() {
            Projection p = new Projection("EPSG:32633", 1.0, 0.0, 0.0);
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new RasterGrid(100_000, 100_000, p));
            assertTrue(e.getMessage().contains("100000x100000"), e.getMessage());
            assertEquals(Integer.MAX_VALUE, new RasterGrid(Integer.MAX_VALUE, 1, p).pixelCount());
        }

        @Test
        void indexAtOutsideIsMinusOne() {
            RasterGrid g = grid(2, 2, 1.0);
            assertEquals(0, g.indexAt(0.5, 1.5));
            assertEquals(3, g.indexAt(1.5, 0.5));
            assertEquals(-1, g.indexAt(2.5, 0.5));
            assertEquals(-1, g.indexAt(0.5, 2.5));
        }

        @Test
        void regionValidationAndIntersection() {
            assertThrows(IllegalArgumentException.class, () -> new Region(0, 0, 0, 1));
            assertThrows(IllegalArgumentException.class, () -> new Region(0, 0, Double.NaN, 1));

            Region a = new Region(0, 0, 10, 10);
            Region b = new Region(5, 5, 20, 20);
            assertEquals(new Region(5, 5, 10, 10), a.intersection(b));
            assertTrue(a.contains(0, 0));
            assertFalse(a.contains(10, 5));
            assertThrows(MisalignedGridException.class, () -> a.intersection(new Region(10, 0, 11, 1)));
        }

        @Test
        void projectionValidation() {
            assertThrows(IllegalArgumentException.class, () -> new Projection(" ", 1.0, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new Projection(CRS, 0.0, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new Projection(CRS, 1.0, Double.POSITIVE_INFINITY, 0));
        }
    }

    /* ============================================================
       Construction and metadata
       ============================================================ */

    @Nested
    @DisplayName("Construction and metadata")
    class Construction {

        @Test
        void keepsBandOrderAndCopiesSamples() {
            double[] red = {1, 2, 3, 4};
            RasterImage img = RasterImage.builder(grid(2, 2, 1.0))
                    .band("red", red)
                    .constantBand("green", 7.0)
                    .build();
            red[0] = 99;

            assertEquals(List.of("red", "green"), img.bandNames());
            assertEquals(1, img.bandIndex("green"));
            assertEquals(1.0, img.sample(0, 0, 0));
            assertEquals(7.0, img.sample(1, 1, 1));
            assertEquals(1.0, img.nominalScale());
            assertFalse(img.isConstant());
        }

        @Test
        void wrongSampleCountIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> RasterImage.of(grid(2, 2, 1.0), Map.of("red", new double[]{1, 2, 3})));
        }

        @Test
        void duplicateAndUnknownBandsAreRejected() {
            RasterImage img = image2x2("red", 1, 2, 3, 4);
            assertThrows(IllegalArgumentException.class, () -> img.bandIndex("nir"));
            assertThrows(IllegalArgumentException.class, () -> img.select("nir"));
            assertThrows(IllegalArgumentException.class,
                    () -> RasterImage.builder(grid(2, 2, 1.0)).band("a", 1, 2, 3, 4).band("a", 1, 2, 3, 4));
        }

        @Test
        void constantImageHasNoGrid() {
            RasterImage c = RasterImage.constant(BandVector.of(1.0, 2.0), List.of("a", "b"));
            assertTrue(c.isConstant());
            assertTrue(c.grid().isEmpty());
            assertThrows(IllegalStateException.class, c::nominalScale);
            assertEquals(2.0, c.sampleAt(1, 1e9, -1e9));
            assertThrows(ShapeMismatchException.class,
                    () -> RasterImage.constant(BandVector.of(1.0), List.of("a", "b")));
        }

        @Test
        void sampleAtOutsideFootprintIsNaN() {
            RasterImage img = image2x2("red", 1, 2, 3, 4);
            assertEquals(4.0, img.sampleAt(0, 1.5, 0.5));
            assertTrue(Double.isNaN(img.sampleAt(0, -0.5, 0.5)));
        }
    }

    /* ============================================================
       Algebra
       ============================================================ */

    @Nested
    @DisplayName("Algebra")
    class Algebra {

        @Test
        void pairsBandsOnTheSameGrid() {
            RasterImage a = image2x2("x", 1, 2, 3, 4);
            RasterImage b = image2x2("y", 10, 20, 30, 40);

            RasterImage sum = a.add(b);
            assertArrayEquals(new double[]{11, 22, 33, 44}, sum.bandValues(0), 1e-12);
            assertEquals(List.of("x"), sum.bandNames());

            assertArrayEquals(new double[]{-9, -18, -27, -36}, a.subtract(b).bandValues(0), 1e-12);
            assertArrayEquals(new double[]{10, 40, 90, 160}, a.multiply(b).bandValues(0), 1e-12);
            assertArrayEquals(new double[]{0.1, 0.1, 0.1, 0.1}, a.divide(b).bandValues(0), 1e-12);
            assertArrayEquals(new double[]{1, 4, 9, 16}, a.pow(2).bandValues(0), 1e-12);
        }

        @Test
        void singleBandOperandIsBroadcast() {
            RasterImage rgb = RasterImage.builder(grid(2, 2, 1.0))
                    .band("r", 1, 1, 1, 1)
                    .band("g", 2, 2, 2, 2)
                    .build();
            RasterImage mask = image2x2("m", 0, 1, 0, 1);

            RasterImage left = rgb.multiply(mask);
            assertEquals(List.of("r", "g"), left.bandNames());
            assertArrayEquals(new double[]{0, 2, 0, 2}, left.bandValues(1), 1e-12);

            RasterImage right = mask.multiply(rgb);
            assertEquals(List.of("r", "g"), right.bandNames());
        }

        @Test
        void bandVectorOperandIsBroadcastPerBand() {
            RasterImage rgb = RasterImage.builder(grid(2, 2, 1.0))
                    .band("r", 1, 2, 3, 4)
                    .band("g", 1, 2, 3, 4)
                    .build();
            RasterImage shifted = rgb.subtract(BandVector.of(1.0, 2.0));
            assertArrayEquals(new double[]{0, 1, 2, 3}, shifted.bandValues(0), 1e-12);
            assertArrayEquals(new double[]{-1, 0, 1, 2}, shifted.bandValues(1), 1e-12);

            assertThrows(ShapeMismatchException.class, () -> rgb.add(BandVector.of(1.0, 2.0, 3.0)));
        }

        @Test
        void incompatibleBandCountsAreRejected() {
            RasterImage two = RasterImage.builder(grid(2, 2, 1.0)).constantBand("a", 1).constantBand("b", 1).build();
            RasterImage three = RasterImage.builder(grid(2, 2, 1.0))
                    .constantBand("a", 1).constantBand("b", 1).constantBand("c", 1).build();
            assertThrows(ShapeMismatchException.class, () -> two.add(three));
        }

        @Test
        void coarserRightOperandIsAlignedByNearestNeighbour() {
            RasterImage fine = RasterImage.builder(grid(2, 2, 10.0)).band("x", 1, 2, 3, 4).build();
            RasterImage coarse = RasterImage.builder(grid(1, 1, 20.0)).band("x", 5).build();

            RasterImage diff = fine.subtract(coarse);
            assertEquals(fine.requireGrid(), diff.requireGrid());
            assertArrayEquals(new double[]{-4, -3, -2, -1}, diff.bandValues(0), 1e-12);
        }

        @Test
        void differentCrsOrNoOverlapIsMisaligned() {
            RasterImage a = image2x2("x", 1, 2, 3, 4);
            RasterImage otherCrs = RasterImage.builder(
                    new RasterGrid(2, 2, new Projection("EPSG:4326", 1.0, 0.0, 2.0))).band("x", 1, 2, 3, 4).build();
            RasterImage farAway = RasterImage.builder(
                    new RasterGrid(2, 2, new Projection(CRS, 1.0, 100.0, 2.0))).band("x", 1, 2, 3, 4).build();

            assertThrows(MisalignedGridException.class, () -> a.subtract(otherCrs));
            assertThrows(MisalignedGridException.class, () -> a.subtract(farAway));
        }

        @Test
        void selectAndRename() {
            RasterImage rgb = RasterImage.builder(grid(2, 2, 1.0))
                    .band("r", 1, 2, 3, 4)
                    .band("g", 5, 6, 7, 8)
                    .build();

            RasterImage g = rgb.select("g");
            assertEquals(List.of("g"), g.bandNames());
            assertArrayEquals(new double[]{5, 6, 7, 8}, g.bandValues(0), 1e-12);

            assertEquals(List.of("a", "b"), rgb.rename(List.of("a", "b")).bandNames());
            assertThrows(ShapeMismatchException.class, () -> rgb.rename(List.of("a")));
            assertThrows(IllegalArgumentException.class, () -> rgb.rename(List.of("a", "a")));
        }

        @Test
        void nanSamplesStayMasked() {
            RasterImage a = image2x2("x", 1, Double.NaN, 3, 4);
            RasterImage doubled = a.multiply(2.0);
            assertTrue(Double.isNaN(doubled.sample(0, 1, 0)));
            assertEquals(8.0, doubled.sample(0, 1, 1));
        }
    }
}
