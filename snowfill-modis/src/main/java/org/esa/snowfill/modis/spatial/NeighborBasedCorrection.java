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

import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.SpatialCorrectionMethod;
import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.SnowCoverGrid;

/**
 * Fills a gap above the altitude threshold with snow if most of its resolved 8-neighbours that are
 * also above the threshold show snow. Gaps at or below the threshold are never corrected.
 */
public class NeighborBasedCorrection implements SpatialCorrection {

    private static final int NEIGHBOURHOOD_RADIUS = 1;

    private final double altitudeThreshold;
    private final float snowThreshold;
    private final float snowValue;

    public NeighborBasedCorrection(double altitudeThreshold, float snowThreshold, float snowValue) {
        this.altitudeThreshold = altitudeThreshold;
        this.snowThreshold = snowThreshold;
        this.snowValue = snowValue;
    }

    @Override
    public SpatialCorrectionMethod getMethod() {
        return SpatialCorrectionMethod.NEIGHBOR_BASED;
    }

    @Override
    public DayCorrection prepareDay(int day, SpatialCorrectionContext context) {
        final SnowCoverGrid grid = context.getGrid();
        final ElevationGrid elevation = context.getElevation();
        return (y, x) -> {
            if (!(elevation.get(y, x) > altitudeThreshold)) {
                return SnowFillConstants.NO_DATA_VALUE;
            }
            final int leftBorder = Math.max(x - NEIGHBOURHOOD_RADIUS, 0);
            final int rightBorder = Math.min(x + NEIGHBOURHOOD_RADIUS, elevation.getWidth() - 1);
            final int topBorder = Math.max(y - NEIGHBOURHOOD_RADIUS, 0);
            final int bottomBorder = Math.min(y + NEIGHBOURHOOD_RADIUS, elevation.getHeight() - 1);

            int qualifying = 0;
            int snow = 0;
            for (int j = topBorder; j <= bottomBorder; j++) {
                for (int i = leftBorder; i <= rightBorder; i++) {
                    if ((i == x && j == y) || !grid.isResolved(day, j, i) ||
                            !(elevation.get(j, i) > altitudeThreshold)) {
                        continue;
                    }
                    qualifying++;
                    if (grid.get(day, j, i) > snowThreshold) {
                        snow++;
                    }
                }
            }
            // strict majority
            return qualifying > 0 && 2 * snow > qualifying ? snowValue : SnowFillConstants.NO_DATA_VALUE;
        };
    }
}
