/*
 * Copyright (C) 2024 Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 */
package org.esa.snowfill.core.stats;

/**
 * Pixel counters of a single day.
 */
public class DailyPixelCounts {

    private final int day;
    private final long[] counts;

    DailyPixelCounts(int day, long[] counts) {
        this.day = day;
        this.counts = counts;
    }

    public int getDay() {
        return day;
    }

    public long get(PixelCounter counter) {
        return counts[counter.ordinal()];
    }

    public long getGapsAfterFusion() {
        return get(PixelCounter.UNRESOLVED_AFTER_FUSION);
    }

    public long getTemporallyFilled() {
        return get(PixelCounter.INTERPOLATED);
    }

    public long getSpatiallyFilled() {
        return get(PixelCounter.SPATIALLY_CORRECTED);
    }

    public long getFinalGaps() {
        return get(PixelCounter.FINAL_REMAINING_GAP);
    }
}
