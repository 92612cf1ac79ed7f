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

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.SpatialCorrectionMethod;
import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.quality.QualityVerdict;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.fusion.VerdictGrid;

import java.util.Arrays;

/**
 * Fills gaps from the elevation statistics of the snow pixels of the same day:
 * gaps above mean + std of the snow elevations become snow, gaps below mean - std become snow free.
 * <p>
 * A day is skipped if it has fewer snow pixels than the minimum sample count, or if the share of
 * gaps among the pixels above the altitude threshold reaches the maximum gap ratio (a ratio of 1.0
 * disables this check).
 */
public class ElevationMeanCorrection implements SpatialCorrection {

    private final float snowValue;
    private final float noSnowValue;
    private final int minSnowSampleCount;
    private final double maxHighElevationGapRatio;
    private final double altitudeThreshold;

    public ElevationMeanCorrection(float snowValue, float noSnowValue, int minSnowSampleCount,
                                   double maxHighElevationGapRatio, double altitudeThreshold) {
        this.snowValue = snowValue;
        this.noSnowValue = noSnowValue;
        this.minSnowSampleCount = Math.max(1, minSnowSampleCount);
        this.maxHighElevationGapRatio = maxHighElevationGapRatio;
        this.altitudeThreshold = altitudeThreshold;
    }

    @Override
    public SpatialCorrectionMethod getMethod() {
        return SpatialCorrectionMethod.ELEVATION_MEAN;
    }

    @Override
    public DayCorrection prepareDay(int day, SpatialCorrectionContext context) {
        final double[] snowElevations = collectSnowElevations(day, context);
        if (snowElevations.length < minSnowSampleCount) {
            SnowFillUtils.LOG.fine("Day " + day + ": " + snowElevations.length +
                                           " snow pixels, no elevation correction");
            return null;
        }
        if (maxHighElevationGapRatio < 1.0) {
            final double gapRatio = computeHighElevationGapRatio(day, context);
            if (gapRatio >= maxHighElevationGapRatio) {
                SnowFillUtils.LOG.fine("Day " + day + ": gap ratio " + gapRatio +
                                               " above altitude threshold, no elevation correction");
                return null;
            }
        }
        final double mean = new Mean().evaluate(snowElevations);
        final double std = new StandardDeviation(false).evaluate(snowElevations);
        final double upper = mean + std;
        final double lower = mean - std;
        final ElevationGrid elevation = context.getElevation();
        return (y, x) -> {
            final float h = elevation.get(y, x);
            if (h > upper) {
                return snowValue;
            } else if (h < lower) {
                return noSnowValue;
            }
            return SnowFillConstants.NO_DATA_VALUE;
        };
    }

    private static double[] collectSnowElevations(int day, SpatialCorrectionContext context) {
        final VerdictGrid verdicts = context.getVerdicts();
        final ElevationGrid elevation = context.getElevation();
        final StudyAreaMask studyArea = context.getStudyArea();
        final int height = elevation.getHeight();
        final int width = elevation.getWidth();
        double[] values = new double[64];
        int n = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (studyArea.isInside(y, x) && verdicts.get(day, y, x) == QualityVerdict.SNOW_VALID) {
                    if (n == values.length) {
                        values = Arrays.copyOf(values, 2 * n);
                    }
                    values[n++] = elevation.get(y, x);
                }
            }
        }
        return Arrays.copyOf(values, n);
    }

    private double computeHighElevationGapRatio(int day, SpatialCorrectionContext context) {
        final SnowCoverGrid grid = context.getGrid();
        final ElevationGrid elevation = context.getElevation();
        final StudyAreaMask studyArea = context.getStudyArea();
        long highPixels = 0;
        long highGaps = 0;
        for (int y = 0; y < elevation.getHeight(); y++) {
            for (int x = 0; x < elevation.getWidth(); x++) {
                if (studyArea.isInside(y, x) && elevation.get(y, x) > altitudeThreshold) {
                    highPixels++;
                    if (!grid.isResolved(day, y, x)) {
                        highGaps++;
                    }
                }
            }
        }
        return highPixels > 0 ? (double) highGaps / highPixels : 0.0;
    }
}
