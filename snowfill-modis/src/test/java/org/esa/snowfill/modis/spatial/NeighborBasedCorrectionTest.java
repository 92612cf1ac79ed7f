package org.esa.snowfill.modis.spatial;

import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.modis.StageResult;
import org.esa.snowfill.modis.fusion.VerdictGrid;
import org.junit.Test;

import static org.esa.snowfill.modis.ModisTestGrids.ND;
import static org.esa.snowfill.modis.ModisTestGrids.elevation;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class NeighborBasedCorrectionTest {

    private static final SpatialCorrection CORRECTION = new NeighborBasedCorrection(1000.0, 50.0f, 100.0f);

    @Test
    public void testMajorityOfSnowNeighbours() {
        final float[][][] values = {{
                {100.0f, 100.0f, 100.0f},
                {100.0f, ND, 0.0f},
                {100.0f, 0.0f, 0.0f}}};

        final StageResult result = correct(values, elevation(3, 3, 1500.0f));

        assertEquals(100.0f, result.getGrid().get(0, 1, 1), 0.0f);
        assertEquals(1, result.getCounts().get(PixelCounter.SPATIALLY_CORRECTED_SNOW));
    }

    @Test
    public void testTieIsNoMajority() {
        final float[][][] values = {{
                {100.0f, 100.0f, 100.0f},
                {100.0f, ND, 0.0f},
                {0.0f, 0.0f, 0.0f}}};

        final StageResult result = correct(values, elevation(3, 3, 1500.0f));

        assertFalse(result.getGrid().isResolved(0, 1, 1));
        assertEquals(1, result.getCounts().get(PixelCounter.FINAL_REMAINING_GAP));
    }

    @Test
    public void testGapBelowAltitudeThresholdIsNotCorrected() {
        final float[][][] values = {{
                {100.0f, 100.0f, 100.0f},
                {100.0f, ND, 100.0f},
                {100.0f, 100.0f, 100.0f}}};
        final float[][] elevation = elevation(3, 3, 1500.0f);
        elevation[1][1] = 1000.0f;

        assertFalse(correct(values, elevation).getGrid().isResolved(0, 1, 1));
    }

    @Test
    public void testLowNeighboursDoNotCount() {
        final float[][][] values = {{
                {100.0f, 100.0f, 100.0f},
                {100.0f, ND, 0.0f},
                {100.0f, 0.0f, 0.0f}}};
        final float[][] elevation = elevation(3, 3, 1500.0f);
        // 3 of the 5 snow neighbours are low, leaving 2 snow against 3 snow free
        elevation[0][0] = 900.0f;
        elevation[1][0] = 900.0f;
        elevation[2][0] = 900.0f;

        assertFalse(correct(values, elevation).getGrid().isResolved(0, 1, 1));
    }

    @Test
    public void testCornerPixelUsesExistingNeighbours() {
        final float[][][] values = {{
                {ND, 100.0f, 0.0f},
                {60.0f, 0.0f, 0.0f},
                {0.0f, 0.0f, 0.0f}}};

        final SnowCoverGrid grid = correct(values, elevation(3, 3, 1500.0f)).getGrid();

        assertEquals(100.0f, grid.get(0, 0, 0), 0.0f);
    }

    @Test
    public void testSnowThresholdIsExclusive() {
        final float[][][] values = {{
                {ND, 50.0f, 0.0f},
                {50.0f, 100.0f, 0.0f},
                {0.0f, 0.0f, 0.0f}}};

        assertFalse(correct(values, elevation(3, 3, 1500.0f)).getGrid().isResolved(0, 0, 0));
    }

    @Test
    public void testCorrectedGapsDoNotSupportOtherGaps() {
        // the right gap has 2 snow against 2 snow free neighbours; the corrected left gap must not tip it
        final float[][][] values = {{
                {100.0f, 100.0f, 100.0f, 0.0f},
                {100.0f, ND, ND, 0.0f}}};

        final SnowCoverGrid grid = correct(values, elevation(2, 4, 1500.0f)).getGrid();

        assertEquals(100.0f, grid.get(0, 1, 1), 0.0f);
        assertFalse(grid.isResolved(0, 1, 2));
    }

    private static StageResult correct(float[][][] values, float[][] elevation) {
        final SnowCoverGrid grid = SnowCoverGrid.of(values);
        final ElevationGrid elevationGrid = new ElevationGrid(elevation);
        final VerdictGrid verdicts = new VerdictGrid(grid.getNumDays(), grid.getHeight(), grid.getWidth());
        return new SpatialCorrectionOp(CORRECTION, 100.0f, 1)
                .correct(grid, verdicts, elevationGrid, StudyAreaMask.create(elevationGrid, null));
    }
}
