package org.esa.snowfill.modis.temporal;

import org.esa.snowfill.core.InterpolationMethod;
import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.modis.StageResult;
import org.junit.Test;

import static org.esa.snowfill.modis.ModisTestGrids.ND;
import static org.esa.snowfill.modis.ModisTestGrids.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class TemporalInterpolationOpTest {

    private static final StudyAreaMask SINGLE_PIXEL =
            StudyAreaMask.create(new ElevationGrid(new float[][]{{500.0f}}), null);

    @Test
    public void testLinearScenario() {
        final SnowCoverGrid fused = SnowCoverGrid.of(series(ND, 20.0f, ND, ND, 80.0f, ND));

        final StageResult result = new TemporalInterpolationOp(InterpolationMethod.LINEAR, 1)
                .interpolate(fused, SINGLE_PIXEL);
        final SnowCoverGrid grid = result.getGrid();

        // only day 1 in the window [0, 2]
        assertEquals(20.0f, grid.get(0, 0, 0), 0.0f);
        assertEquals(20.0f, grid.get(1, 0, 0), 0.0f);
        // 20 at offset -1, 80 at offset +2
        assertEquals(40.0f, grid.get(2, 0, 0), 1.0e-4f);
        // 20 at offset -2, 80 at offset +1
        assertEquals(60.0f, grid.get(3, 0, 0), 1.0e-4f);
        assertEquals(80.0f, grid.get(4, 0, 0), 0.0f);
        // no future value, nearest past is day 4
        assertEquals(80.0f, grid.get(5, 0, 0), 0.0f);

        final PixelCounts counts = result.getCounts();
        assertEquals(4, counts.get(PixelCounter.INTERPOLATED));
        assertEquals(2, counts.get(PixelCounter.INTERPOLATED_LINEAR));
        assertEquals(2, counts.get(PixelCounter.INTERPOLATED_NEAREST));
        assertEquals(0, counts.get(PixelCounter.REMAINING_GAP_AFTER_TEMPORAL));
        assertEquals(1, counts.get(PixelCounter.INTERPOLATED, 2));
    }

    @Test
    public void testOnlyFusedValuesSupportInterpolation() {
        final SnowCoverGrid fused = SnowCoverGrid.of(series(20.0f, ND, ND, ND, ND, ND, ND));

        final StageResult result = new TemporalInterpolationOp(InterpolationMethod.NEAREST, 1)
                .interpolate(fused, SINGLE_PIXEL);
        final SnowCoverGrid grid = result.getGrid();

        for (int t = 0; t <= 3; t++) {
            assertEquals(20.0f, grid.get(t, 0, 0), 0.0f);
        }
        for (int t = 4; t <= 6; t++) {
            assertFalse("day " + t, grid.isResolved(t, 0, 0));
        }
        assertEquals(3, result.getCounts().get(PixelCounter.INTERPOLATED));
        assertEquals(3, result.getCounts().get(PixelCounter.REMAINING_GAP_AFTER_TEMPORAL));
    }

    @Test
    public void testFusedGridIsNotModified() {
        final SnowCoverGrid fused = SnowCoverGrid.of(series(ND, 50.0f, ND));

        new TemporalInterpolationOp(InterpolationMethod.NEAREST, 1).interpolate(fused, SINGLE_PIXEL);

        assertFalse(fused.isResolved(0, 0, 0));
        assertFalse(fused.isResolved(2, 0, 0));
    }

    @Test
    public void testPixelsOutsideStudyAreaAreSkipped() {
        final float[][][] values = new float[3][1][2];
        for (int t = 0; t < 3; t++) {
            values[t][0][0] = t == 1 ? ND : 30.0f;
            values[t][0][1] = t == 1 ? ND : 30.0f;
        }
        final StudyAreaMask area = StudyAreaMask.create(new ElevationGrid(new float[][]{{500.0f, ND}}), null);

        final StageResult result = new TemporalInterpolationOp(InterpolationMethod.LINEAR, 2)
                .interpolate(SnowCoverGrid.of(values), area);

        assertEquals(30.0f, result.getGrid().get(1, 0, 0), 1.0e-4f);
        assertFalse(result.getGrid().isResolved(1, 0, 1));
        assertEquals(1, result.getCounts().get(PixelCounter.INTERPOLATED));
        assertEquals(0, result.getCounts().get(PixelCounter.REMAINING_GAP_AFTER_TEMPORAL));
    }

    @Test
    public void testCubicOnSeries() {
        // 40 + 5 * day, day 3 missing
        final SnowCoverGrid fused = SnowCoverGrid.of(series(40.0f, 45.0f, 50.0f, ND, 60.0f, 65.0f));

        final StageResult result = new TemporalInterpolationOp(InterpolationMethod.CUBIC, 1)
                .interpolate(fused, SINGLE_PIXEL);

        assertEquals(55.0f, result.getGrid().get(3, 0, 0), 1.0e-2f);
        assertEquals(1, result.getCounts().get(PixelCounter.INTERPOLATED_CUBIC));
    }

    @Test
    public void testFailedCubicFitCountedAsLinear() {
        final SnowCoverGrid fused = SnowCoverGrid.of(series(40.0f, 45.0f, 50.0f, ND, 60.0f, 65.0f));
        final TemporalInterpolationOp op = new TemporalInterpolationOp(InterpolationMethod.CUBIC, 1) {
            @Override
            TemporalInterpolator createInterpolator() {
                return new TemporalInterpolatorTest.NonConvergingInterpolator();
            }
        };

        final StageResult result = op.interpolate(fused, SINGLE_PIXEL);

        // 50 at offset -1, 60 at offset +1
        assertEquals(55.0f, result.getGrid().get(3, 0, 0), 1.0e-4f);
        final PixelCounts counts = result.getCounts();
        assertEquals(1, counts.get(PixelCounter.INTERPOLATED));
        assertEquals(0, counts.get(PixelCounter.INTERPOLATED_CUBIC));
        assertEquals(1, counts.get(PixelCounter.INTERPOLATED_LINEAR));
    }
}
