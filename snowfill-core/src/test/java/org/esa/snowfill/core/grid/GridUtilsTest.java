package org.esa.snowfill.core.grid;

import org.esa.snowfill.core.GapFillException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GridUtilsTest {

    @Test
    public void testMatchingShapesPass() {
        GridUtils.validateShapes(new SnowCoverGrid(2, 3, 4), new SnowCoverGrid(2, 3, 4),
                                 new ClassCodeGrid(new int[2][3][4]), new ClassCodeGrid(new int[2][3][4]),
                                 new ElevationGrid(new float[3][4]));
    }

    @Test
    public void testDifferentNumberOfDays() {
        try {
            GridUtils.validateShapes(new SnowCoverGrid(2, 3, 4), new SnowCoverGrid(3, 3, 4),
                                     new ClassCodeGrid(new int[2][3][4]), new ClassCodeGrid(new int[2][3][4]),
                                     new ElevationGrid(new float[3][4]));
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getMessage().contains("[3, 3, 4]"));
        }
    }

    @Test(expected = GapFillException.class)
    public void testDifferentElevationShape() {
        GridUtils.validateShapes(new SnowCoverGrid(2, 3, 4), new SnowCoverGrid(2, 3, 4),
                                 new ClassCodeGrid(new int[2][3][4]), new ClassCodeGrid(new int[2][3][4]),
                                 new ElevationGrid(new float[4][3]));
    }

    @Test(expected = GapFillException.class)
    public void testDifferentClassGridShape() {
        GridUtils.validateObservationShapes(new SnowCoverGrid(2, 3, 4), new SnowCoverGrid(2, 3, 4),
                                            new ClassCodeGrid(new int[2][3][4]), new ClassCodeGrid(new int[2][3][5]));
    }

    @Test
    public void testCellCount() {
        assertEquals(24, GridUtils.cellCount(2, 3, 4));
        assertEquals(0, GridUtils.cellCount(0, 2400, 2400));
        assertEquals(Integer.MAX_VALUE, GridUtils.cellCount(1, 1, Integer.MAX_VALUE));
    }

    @Test
    public void testCellCountBeyondArrayLimit() {
        try {
            // two years of daily 2400 x 2400 tiles
            GridUtils.cellCount(730, 2400, 2400);
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getMessage().contains("[730, 2400, 2400]"));
        }
        try {
            // product wraps to 65536 in int arithmetic
            GridUtils.cellCount(1, 65536, 65537);
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getMessage().contains("[1, 65536, 65537]"));
        }
        try {
            GridUtils.cellCount(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE);
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getCause() instanceof ArithmeticException);
        }
    }
}
