package org.esa.snowfill.core.stats;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PixelCountsTest {

    @Test
    public void testIncrementPerDay() {
        final PixelCounts counts = new PixelCounts(3);
        counts.increment(PixelCounter.TOTAL, 0);
        counts.increment(PixelCounter.TOTAL, 2);
        counts.add(PixelCounter.TOTAL, 2, 5);

        assertEquals(7, counts.get(PixelCounter.TOTAL));
        assertEquals(1, counts.get(PixelCounter.TOTAL, 0));
        assertEquals(0, counts.get(PixelCounter.TOTAL, 1));
        assertEquals(6, counts.get(PixelCounter.TOTAL, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeAmount() {
        new PixelCounts(1).add(PixelCounter.TOTAL, 0, -1);
    }

    @Test
    public void testMergeIsOrderIndependent() {
        final PixelCounts a = create(1, 2);
        final PixelCounts b = create(3, 4);
        final PixelCounts c = create(5, 6);

        final PixelCounts abc = new PixelCounts(2);
        abc.add(a);
        abc.add(b);
        abc.add(c);
        final PixelCounts cba = new PixelCounts(2);
        cba.add(c);
        cba.add(b);
        cba.add(a);

        for (PixelCounter counter : PixelCounter.values()) {
            assertEquals(abc.get(counter, 0), cba.get(counter, 0));
            assertEquals(abc.get(counter, 1), cba.get(counter, 1));
        }
        assertEquals(9, abc.get(PixelCounter.PRIMARY_SOURCED));
        assertEquals(12, abc.get(PixelCounter.INTERPOLATED));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMergeDifferentNumberOfDays() {
        new PixelCounts(2).add(new PixelCounts(3));
    }

    @Test
    public void testSnapshotIsFrozen() {
        final PixelCounts counts = create(1, 1);
        final PixelCountsSnapshot snapshot = counts.snapshot();
        counts.increment(PixelCounter.PRIMARY_SOURCED, 0);

        assertEquals(1, snapshot.get(PixelCounter.PRIMARY_SOURCED));
        assertEquals(2, counts.get(PixelCounter.PRIMARY_SOURCED));
        final Map<PixelCounter, Long> map = snapshot.asMap();
        assertEquals(PixelCounter.values().length, map.size());
        assertEquals(Long.valueOf(1), map.get(PixelCounter.INTERPOLATED));
    }

    @Test
    public void testConsistency() {
        final PixelCounts counts = new PixelCounts(1);
        counts.add(PixelCounter.TOTAL, 0, 10);
        counts.add(PixelCounter.PRIMARY_SOURCED, 0, 4);
        counts.add(PixelCounter.SECONDARY_SOURCED, 0, 1);
        counts.add(PixelCounter.INTERPOLATED, 0, 2);
        counts.add(PixelCounter.SPATIALLY_CORRECTED, 0, 1);
        assertFalse(counts.snapshot().isConsistent());

        counts.add(PixelCounter.FINAL_REMAINING_GAP, 0, 2);
        assertTrue(counts.snapshot().isConsistent());
    }

    @Test
    public void testDailyCounts() {
        final PixelCounts counts = new PixelCounts(2);
        counts.add(PixelCounter.UNRESOLVED_AFTER_FUSION, 1, 8);
        counts.add(PixelCounter.INTERPOLATED, 1, 5);
        counts.add(PixelCounter.SPATIALLY_CORRECTED, 1, 2);
        counts.add(PixelCounter.FINAL_REMAINING_GAP, 1, 1);

        final DailyPixelCounts daily = counts.snapshot().getDaily(1);
        assertEquals(1, daily.getDay());
        assertEquals(8, daily.getGapsAfterFusion());
        assertEquals(5, daily.getTemporallyFilled());
        assertEquals(2, daily.getSpatiallyFilled());
        assertEquals(1, daily.getFinalGaps());
    }

    private static PixelCounts create(int primary, int interpolated) {
        final PixelCounts counts = new PixelCounts(2);
        counts.add(PixelCounter.PRIMARY_SOURCED, 0, primary);
        counts.add(PixelCounter.INTERPOLATED, 1, interpolated);
        return counts;
    }
}
