package org.esa.snowfill.core.grid;

import org.esa.snowfill.core.GapFillException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SnowCoverGridTest {

    @Test
    public void testOfTakesValuesOutsideValidRangeAsGaps() {
        final SnowCoverGrid grid = SnowCoverGrid.of(new float[][][]{{{0.0f, 55.5f, 100.0f, 200.0f, Float.NaN, -1.0f}}});

        assertEquals(1, grid.getNumDays());
        assertEquals(1, grid.getHeight());
        assertEquals(6, grid.getWidth());
        assertEquals(0.0f, grid.get(0, 0, 0), 0.0f);
        assertEquals(55.5f, grid.get(0, 0, 1), 0.0f);
        assertEquals(100.0f, grid.get(0, 0, 2), 0.0f);
        assertFalse(grid.isResolved(0, 0, 3));
        assertFalse(grid.isResolved(0, 0, 4));
        assertFalse(grid.isResolved(0, 0, 5));
        assertEquals(3, grid.countResolved());
    }

    @Test
    public void testResolveOnlyOnce() {
        final SnowCoverGrid grid = new SnowCoverGrid(2, 2, 2);
        assertFalse(grid.isResolved(1, 1, 0));

        grid.resolve(1, 1, 0, 42.0f);
        assertTrue(grid.isResolved(1, 1, 0));
        assertEquals(42.0f, grid.get(1, 1, 0), 0.0f);

        try {
            grid.resolve(1, 1, 0, 43.0f);
            fail("IllegalStateException expected");
        } catch (IllegalStateException expected) {
            assertEquals(42.0f, grid.get(1, 1, 0), 0.0f);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResolveRejectsValueAboveRange() {
        new SnowCoverGrid(1, 1, 1).resolve(0, 0, 0, 100.5f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResolveRejectsNaN() {
        new SnowCoverGrid(1, 1, 1).resolve(0, 0, 0, Float.NaN);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testGetOutsideGrid() {
        new SnowCoverGrid(1, 2, 2).get(0, 2, 0);
    }

    @Test
    public void testCopyIsIndependent() {
        final SnowCoverGrid grid = new SnowCoverGrid(1, 1, 2);
        grid.resolve(0, 0, 0, 10.0f);

        final SnowCoverGrid copy = grid.copy();
        copy.resolve(0, 0, 1, 20.0f);

        assertFalse(grid.isResolved(0, 0, 1));
        assertEquals(10.0f, copy.get(0, 0, 0), 0.0f);
        assertEquals(20.0f, copy.get(0, 0, 1), 0.0f);
    }

    @Test
    public void testToArray() {
        final float[][][] values = {{{1.0f, 2.0f}, {3.0f, Float.NaN}}, {{5.0f, 6.0f}, {7.0f, 8.0f}}};
        final float[][][] result = SnowCoverGrid.of(values).toArray();

        assertEquals(3.0f, result[0][1][0], 0.0f);
        assertTrue(Float.isNaN(result[0][1][1]));
        assertEquals(8.0f, result[1][1][1], 0.0f);
    }

    @Test
    public void testTooManyCellsRejected() {
        try {
            new SnowCoverGrid(1, 65536, 65537);
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getMessage().contains("exceeds"));
        }
    }

    @Test
    public void testDistinctCellsDoNotShareStorage() {
        final SnowCoverGrid grid = new SnowCoverGrid(3, 4, 5);
        grid.resolve(0, 0, 4, 42.0f);
        assertFalse(grid.isResolved(0, 1, 0));
        grid.resolve(1, 3, 4, 7.0f);
        assertFalse(grid.isResolved(2, 0, 0));
        assertEquals(2, grid.countResolved());
    }
}
