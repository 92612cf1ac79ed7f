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
package org.esa.snowfill.modis.temporal;

import org.esa.snowfill.core.InterpolationMethod;
import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.grid.GridUtils;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.ModisSnowFillUtils;
import org.esa.snowfill.modis.StageResult;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Fills gaps of the fused grid from valid fused values of neighbouring days
 * (3 days before, 2 days after). Resolved cells are carried over unchanged, and only
 * fused values are used as support, never values interpolated in this stage.
 */
public class TemporalInterpolationOp {

    private final InterpolationMethod method;
    private final int numWorkers;

    public TemporalInterpolationOp(InterpolationMethod method, int numWorkers) {
        this.method = method;
        this.numWorkers = numWorkers;
    }

    public StageResult interpolate(SnowCoverGrid fused, StudyAreaMask studyArea) {
        final int numDays = fused.getNumDays();
        final int height = fused.getHeight();
        final int width = fused.getWidth();
        GridUtils.validateStudyArea(studyArea, height, width);
        SnowFillUtils.LOG.info("Temporal interpolation (" + method + ") for " + numDays + " days");

        final SnowCoverGrid interpolated = fused.copy();

        final List<Callable<PixelCounts>> tasks = new ArrayList<>();
        for (Rectangle slice : ModisSnowFillUtils.sliceRows(width, height, numWorkers)) {
            tasks.add(() -> {
                final PixelCounts counts = new PixelCounts(numDays);
                final TemporalInterpolator interpolator = createInterpolator();
                final int[] offsets = new int[SnowFillConstants.WINDOW_SIZE];
                final float[] values = new float[SnowFillConstants.WINDOW_SIZE];
                for (int t = 0; t < numDays; t++) {
                    final TemporalWindow window = TemporalWindow.around(t, numDays);
                    for (int y = slice.y; y < slice.y + slice.height; y++) {
                        for (int x = slice.x; x < slice.x + slice.width; x++) {
                            if (!studyArea.isInside(y, x) || fused.isResolved(t, y, x)) {
                                continue;
                            }
                            int n = 0;
                            for (int d = window.getFirstDay(); d <= window.getLastDay(); d++) {
                                if (d != t && fused.isResolved(d, y, x)) {
                                    offsets[n] = d - t;
                                    values[n] = fused.get(d, y, x);
                                    n++;
                                }
                            }
                            final float value = interpolator.interpolate(offsets, values, n);
                            final InterpolationMethod applied = interpolator.getAppliedMethod();
                            if (applied == null) {
                                counts.increment(PixelCounter.REMAINING_GAP_AFTER_TEMPORAL, t);
                                continue;
                            }
                            interpolated.resolve(t, y, x, value);
                            counts.increment(PixelCounter.INTERPOLATED, t);
                            counts.increment(getMethodCounter(applied), t);
                        }
                    }
                }
                return counts;
            });
        }
        final PixelCounts counts = ModisSnowFillUtils.runTasks(tasks, numWorkers, numDays);
        SnowFillUtils.LOG.info("Temporal interpolation: " + counts.get(PixelCounter.INTERPOLATED) +
                                       " filled, " + counts.get(PixelCounter.REMAINING_GAP_AFTER_TEMPORAL) +
                                       " remaining gaps");
        return new StageResult(interpolated, counts);
    }

    TemporalInterpolator createInterpolator() {
        return new TemporalInterpolator(method);
    }

    static PixelCounter getMethodCounter(InterpolationMethod method) {
        switch (method) {
            case CUBIC:
                return PixelCounter.INTERPOLATED_CUBIC;
            case LINEAR:
                return PixelCounter.INTERPOLATED_LINEAR;
            default:
                return PixelCounter.INTERPOLATED_NEAREST;
        }
    }
}
