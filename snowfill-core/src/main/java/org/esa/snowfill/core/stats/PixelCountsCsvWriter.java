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

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes pixel counters as CSV: one table with a row per day, one with the run totals.
 */
public class PixelCountsCsvWriter {

    static final String DAILY_HEADER = "date,original_nan_count,temporal_filled_count,spatial_filled_count," +
            "final_nan_count";
    static final String TOTALS_HEADER = "counter,count";

    private static final char SEPARATOR = ',';
    private static final String NEW_LINE = "\n";

    /**
     * @param snapshot - the counters
     * @param dayLabels - one label per day (e.g. the date), or null to use the day index
     * @param writer - the target
     * @throws IOException if writing fails
     */
    public void writeDaily(PixelCountsSnapshot snapshot, List<String> dayLabels, Writer writer) throws IOException {
        if (dayLabels != null && dayLabels.size() != snapshot.getNumDays()) {
            throw new IllegalArgumentException("Expected " + snapshot.getNumDays() + " day labels, got " +
                                                       dayLabels.size());
        }
        writer.write(DAILY_HEADER);
        writer.write(NEW_LINE);
        for (int t = 0; t < snapshot.getNumDays(); t++) {
            final DailyPixelCounts daily = snapshot.getDaily(t);
            writer.write(dayLabels != null ? dayLabels.get(t) : Integer.toString(t));
            writer.write(SEPARATOR);
            writer.write(Long.toString(daily.getGapsAfterFusion()));
            writer.write(SEPARATOR);
            writer.write(Long.toString(daily.getTemporallyFilled()));
            writer.write(SEPARATOR);
            writer.write(Long.toString(daily.getSpatiallyFilled()));
            writer.write(SEPARATOR);
            writer.write(Long.toString(daily.getFinalGaps()));
            writer.write(NEW_LINE);
        }
        writer.flush();
    }

    public void writeTotals(PixelCountsSnapshot snapshot, Writer writer) throws IOException {
        writer.write(TOTALS_HEADER);
        writer.write(NEW_LINE);
        for (PixelCounter counter : PixelCounter.values()) {
            writer.write(counter.getLabel());
            writer.write(SEPARATOR);
            writer.write(Long.toString(snapshot.get(counter)));
            writer.write(NEW_LINE);
        }
        writer.flush();
    }
}
