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
package org.esa.snowfill.modis.spatial;

import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.GridUtils;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.ModisSnowFillUtils;
import org.esa.snowfill.modis.StageResult;
import org.esa.snowfill.modis.fusion.VerdictGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Applies a {@link SpatialCorrection} to the gaps left by the temporal interpolation, day by day.
 * Corrections only read the grid before correction, so the result does not depend on the order
 * in which pixels are visited.
 */
public class SpatialCorrectionOp {

    private final SpatialCorrection correction;
    private final float snowValue;
    private final int numWorkers;

    public SpatialCorrectionOp(SpatialCorrection correction, float snowValue, int numWorkers) {
        this.correction = correction;
        this.snowValue = snowValue;
        this.numWorkers = numWorkers;
    }

    public StageResult correct(SnowCoverGrid grid, VerdictGrid verdicts, ElevationGrid elevation,
                               StudyAreaMask studyArea) {
        final int numDays = grid.getNumDays();
        final int height = grid.getHeight();
        final int width = grid.getWidth();
        if (elevation.getHeight() != height || elevation.getWidth() != width) {
            throw new GapFillException("Dimensions of elevation grid [" +
                    elevation.getHeight() + ", " + elevation.getWidth() + "] differ from input grids [" +
                    height + ", " + width + "]. Please check.");
        }
        GridUtils.validateStudyArea(studyArea, height, width);
        SnowFillUtils.LOG.info("Spatial correction (" + correction.getMethod() + ") for " + numDays + " days");

        final SnowCoverGrid corrected = grid.copy();
        final SpatialCorrectionContext context = new SpatialCorrectionContext(grid, verdicts, elevation, studyArea);

        final List<Callable<PixelCounts>> tasks = new ArrayList<>();
        for (int day = 0; day < numDays; day++) {
            final int t = day;
            tasks.add(() -> {
                final PixelCounts counts = new PixelCounts(numDays);
                final SpatialCorrection.DayCorrection dayCorrection = correction.prepareDay(t, context);
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        if (!studyArea.isInside(y, x) || grid.isResolved(t, y, x)) {
                            continue;
                        }
                        final float value = dayCorrection != null ? dayCorrection.correct(y, x) : Float.NaN;
                        if (Float.isNaN(value)) {
                            counts.increment(PixelCounter.FINAL_REMAINING_GAP, t);
                            continue;
                        }
                        corrected.resolve(t, y, x, value);
                        counts.increment(PixelCounter.SPATIALLY_CORRECTED, t);
                        counts.increment(value == snowValue ? PixelCounter.SPATIALLY_CORRECTED_SNOW
                                                 : PixelCounter.SPATIALLY_CORRECTED_NO_SNOW, t);
                    }
                }
                return counts;
            });
        }
        final PixelCounts counts = ModisSnowFillUtils.runTasks(tasks, numWorkers, numDays);
        SnowFillUtils.LOG.info("Spatial correction: " + counts.get(PixelCounter.SPATIALLY_CORRECTED) +
                                       " filled, " + counts.get(PixelCounter.FINAL_REMAINING_GAP) +
                                       " remaining gaps");
        return new StageResult(corrected, counts);
    }
}
