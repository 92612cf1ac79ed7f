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
package org.esa.snowfill.modis;

/**
 * Constants for MODIS snow cover gap filling
 */
public class ModisSnowFillConstants {

    public static final String INTERPOLATION_METHOD_PARAM = "interpolationMethod";
    public static final String SPATIAL_CORRECTION_METHOD_PARAM = "spatialCorrectionMethod";
    public static final String ALTITUDE_THRESHOLD_PARAM = "altitudeThreshold";
    public static final String SNOW_VALUE_PARAM = "snowValue";
    public static final String NO_SNOW_VALUE_PARAM = "noSnowValue";
    public static final String SNOW_THRESHOLD_PARAM = "snowThreshold";
    public static final String MIN_SNOW_SAMPLE_COUNT_PARAM = "minSnowSampleCount";
    public static final String MAX_HIGH_ELEVATION_GAP_RATIO_PARAM = "maxHighElevationGapRatio";
    public static final String NUM_WORKERS_PARAM = "numWorkers";
    public static final String CLASS_TABLE_PARAM = "classTable";
    public static final String CLASS_TABLE_FILE_PARAM = "classTableFile";

    public static final int DEFAULT_MIN_SNOW_SAMPLE_COUNT = 1;
    // a ratio of 1.0 disables the high elevation gap check
    public static final double DEFAULT_MAX_HIGH_ELEVATION_GAP_RATIO = 1.0;

    // cubic polynomial: c0 + c1*t + c2*t^2 + c3*t^3
    public static final double[] CUBIC_FIT_INITIAL = {0.0, 0.0, 0.0, 0.0};
    public static final int CUBIC_MIN_POINTS = 4;

    public static final String INVALID_PARAMETER_ERROR_MESSAGE = "Parameter '%s' = %s is outside %s";

    private ModisSnowFillConstants() {
    }
}
