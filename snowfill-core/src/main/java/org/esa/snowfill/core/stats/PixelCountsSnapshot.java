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

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable view of the pixel counters at the end of a run.
 */
public class PixelCountsSnapshot {

    private final long[][] dailyCounts;
    private final long[] totals;

    PixelCountsSnapshot(long[][] dailyCounts) {
        this.dailyCounts = dailyCounts;
        this.totals = new long[PixelCounter.values().length];
        for (long[] day : dailyCounts) {
            for (int i = 0; i < totals.length; i++) {
                totals[i] += day[i];
            }
        }
    }

    public int getNumDays() {
        return dailyCounts.length;
    }

    public long get(PixelCounter counter) {
        return totals[counter.ordinal()];
    }

    public DailyPixelCounts getDaily(int day) {
        return new DailyPixelCounts(day, dailyCounts[day].clone());
    }

    public Map<PixelCounter, Long> asMap() {
        final Map<PixelCounter, Long> map = new EnumMap<>(PixelCounter.class);
        for (PixelCounter counter : PixelCounter.values()) {
            map.put(counter, totals[counter.ordinal()]);
        }
        return map;
    }

    /**
     * Checks that every pixel-day inside the study area ended up in exactly one outcome:
     * sourced from a sensor, interpolated, spatially corrected or remaining gap.
     *
     * @return true if the counters add up
     */
    public boolean isConsistent() {
        final long outcomes = get(PixelCounter.PRIMARY_SOURCED) + get(PixelCounter.SECONDARY_SOURCED) +
                get(PixelCounter.INTERPOLATED) + get(PixelCounter.SPATIALLY_CORRECTED) +
                get(PixelCounter.FINAL_REMAINING_GAP);
        return outcomes == get(PixelCounter.TOTAL);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("PixelCounts{");
        final PixelCounter[] counters = PixelCounter.values();
        for (int i = 0; i < counters.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(counters[i].getLabel()).append('=').append(totals[i]);
        }
        return sb.append('}').toString();
    }
}
