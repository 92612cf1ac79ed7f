package org.esa.snowfill.modis;

import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.junit.Test;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ModisSnowFillUtilsTest {

    @Test
    public void testSliceRowsCoversAllRows() {
        final List<Rectangle> slices = ModisSnowFillUtils.sliceRows(7, 10, 3);

        assertEquals(3, slices.size());
        int rows = 0;
        int nextRow = 0;
        for (Rectangle slice : slices) {
            assertEquals(nextRow, slice.y);
            assertEquals(7, slice.width);
            rows += slice.height;
            nextRow = slice.y + slice.height;
        }
        assertEquals(10, rows);
    }

    @Test
    public void testSliceRowsMoreSlicesThanRows() {
        final List<Rectangle> slices = ModisSnowFillUtils.sliceRows(4, 2, 8);

        assertEquals(2, slices.size());
        assertEquals(1, slices.get(1).height);
    }

    @Test
    public void testSliceRowsEmptyGrid() {
        assertTrue(ModisSnowFillUtils.sliceRows(0, 5, 2).isEmpty());
    }

    @Test
    public void testRunTasksMergesCounts() {
        final List<Callable<PixelCounts>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            final int day = i % 2;
            tasks.add(() -> {
                final PixelCounts counts = new PixelCounts(2);
                counts.increment(PixelCounter.TOTAL, day);
                return counts;
            });
        }
        final PixelCounts counts = ModisSnowFillUtils.runTasks(tasks, 3, 2);

        assertEquals(5, counts.get(PixelCounter.TOTAL));
        assertEquals(3, counts.get(PixelCounter.TOTAL, 0));
        assertEquals(2, counts.get(PixelCounter.TOTAL, 1));
    }

    @Test
    public void testFailingTask() {
        final List<Callable<PixelCounts>> tasks = new ArrayList<>();
        tasks.add(() -> new PixelCounts(1));
        tasks.add(() -> {
            throw new IllegalStateException("broken slice");
        });
        try {
            ModisSnowFillUtils.runTasks(tasks, 2, 1);
            fail("GapFillException expected");
        } catch (GapFillException expected) {
            assertTrue(expected.getCause() instanceof IllegalStateException);
            assertTrue(expected.getMessage().contains("broken slice"));
        }
    }
}
