package org.fusionqa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BandVectorTest {

    /* ============================================================
       Construction
       ============================================================ */

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        void rejectsNullAndEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new BandVector(null));
            assertThrows(IllegalArgumentException.class, () -> new BandVector(new double[0]));
        }

        @Test
        void copiesInputAndOutput() {
            double[] raw = {1.0, 2.0};
            BandVector v = new BandVector(raw);
            raw[0] = 99.0;
            assertEquals(1.0, v.get(0));

            double[] copy = v.toArrayCopy();
            copy[1] = 99.0;
            assertEquals(2.0, v.get(1));
        }

        @Test
        void getOutOfRangeThrows() {
            BandVector v = BandVector.of(1.0);
            assertThrows(IndexOutOfBoundsException.class, () -> v.get(1));
            assertThrows(IndexOutOfBoundsException.class, () -> v.get(-1));
        }
    }

    /* ============================================================
       Arithmetic
       ============================================================ */

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        void elementWiseOperations() {
            BandVector a = BandVector.of(1.0, 4.0);
            BandVector b = BandVector.of(2.0, 8.0);

            assertEquals(BandVector.of(3.0, 12.0), a.add(b));
            assertEquals(BandVector.of(-1.0, -4.0), a.subtract(b));
            assertEquals(BandVector.of(2.0, 32.0), a.multiply(b));
            assertEquals(BandVector.of(0.5, 0.5), a.divide(b));
            assertEquals(BandVector.of(2.0, 8.0), a.scale(2.0));
            assertEquals(BandVector.of(1.0, 16.0), a.pow(2));
            assertEquals(BandVector.of(1.0, 2.0), a.sqrt());
            assertEquals(BandVector.of(0.0, 2.0), BandVector.of(1.0, 100.0).log10());
        }

        @Test
        void divisionByZeroFollowsIeee() {
            BandVector v = BandVector.of(1.0, 0.0).divide(BandVector.of(0.0, 0.0));
            assertEquals(Double.POSITIVE_INFINITY, v.get(0));
            assertTrue(Double.isNaN(v.get(1)));
            assertFalse(v.isFinite(0));
            assertFalse(v.allFinite());
        }

        @Test
        void log10OfNonPositiveFollowsIeee() {
            BandVector v = BandVector.of(0.0, -1.0).log10();
            assertEquals(Double.NEGATIVE_INFINITY, v.get(0));
            assertTrue(Double.isNaN(v.get(1)));
        }

        @Test
        void sizeMismatchIsShapeMismatch() {
            assertThrows(ShapeMismatchException.class,
                    () -> BandVector.of(1.0, 2.0).add(BandVector.of(1.0)));
        }

        @Test
        void meanPropagatesNaN() {
            assertEquals(2.0, BandVector.of(1.0, 2.0, 3.0).mean(), 1e-12);
            assertTrue(Double.isNaN(BandVector.of(1.0, Double.NaN).mean()));
            assertEquals(Double.POSITIVE_INFINITY, BandVector.of(1.0, Double.POSITIVE_INFINITY).mean());
        }
    }

    @Test
    void equalityIsByValue() {
        assertEquals(BandVector.of(1.0, 2.0), BandVector.of(1.0, 2.0));
        assertEquals(BandVector.of(1.0, 2.0).hashCode(), BandVector.of(1.0, 2.0).hashCode());
        assertNotEquals(BandVector.of(1.0, 2.0), BandVector.of(2.0, 1.0));
        assertEquals("BandVector[1.0, 2.0]", BandVector.of(1.0, 2.0).toString());
    }
}
