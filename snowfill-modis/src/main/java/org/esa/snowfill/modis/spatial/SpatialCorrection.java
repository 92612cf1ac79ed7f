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

import org.esa.snowfill.core.SpatialCorrectionMethod;

/**
 * Strategy to fill the gaps remaining after temporal interpolation, one day at a time.
 * A day is corrected in two phases: {@link #prepareDay} reduces the inputs of the day to
 * whatever the strategy needs, then the returned {@link DayCorrection} is asked for each gap.
 */
public interface SpatialCorrection {

    SpatialCorrectionMethod getMethod();

    /**
     * prepares the correction of one day
     *
     * @param day - the day index
     * @param context - the read-only inputs
     * @return the correction of the day, or null if the day is not corrected
     */
    DayCorrection prepareDay(int day, SpatialCorrectionContext context);

    /**
     * Correction of the gaps of a single day
     */
    interface DayCorrection {

        /**
         * @param y - the y coord
         * @param x - the x coord
         * @return the corrected value, or NaN if the gap stays
         */
        float correct(int y, int x);
    }
}
