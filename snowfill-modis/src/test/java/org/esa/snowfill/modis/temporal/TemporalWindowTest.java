package org.esa.snowfill.modis.temporal;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TemporalWindowTest {

    @Test
    public void testWindowInsideSeries() {
        final TemporalWindow window = TemporalWindow.around(5, 20);

        assertEquals(2, window.getFirstDay());
        assertEquals(7, window.getLastDay());
        assertEquals(6, window.size());
    }

    @Test
    public void testWindowClampedAtStart() {
        final TemporalWindow window = TemporalWindow.around(1, 20);

        assertEquals(0, window.getFirstDay());
        assertEquals(3, window.getLastDay());
    }

    @Test
    public void testWindowClampedAtEnd() {
        final TemporalWindow window = TemporalWindow.around(19, 20);

        assertEquals(16, window.getFirstDay());
        assertEquals(19, window.getLastDay());
        assertEquals(4, window.size());
    }

    @Test
    public void testWindowOfSingleDaySeries() {
        final TemporalWindow window = TemporalWindow.around(0, 1);

        assertEquals(0, window.getFirstDay());
        assertEquals(0, window.getLastDay());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDayOutsideSeries() {
        TemporalWindow.around(3, 3);
    }
}
