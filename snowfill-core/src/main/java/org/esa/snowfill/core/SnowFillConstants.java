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

package org.esa.snowfill.core;

/**
 * SnowFill constants
 */
public class SnowFillConstants {

    /**
     * Marker for a pixel-day without a usable snow cover value.
     */
    public static final float NO_DATA_VALUE = Float.NaN;

    public static final float MIN_SNOW_COVER_VALUE = 0.0f;
    public static final float MAX_SNOW_COVER_VALUE = 100.0f;

    public static final float DEFAULT_SNOW_VALUE = 100.0f;
    public static final float DEFAULT_NO_SNOW_VALUE = 0.0f;
    public static final float DEFAULT_SNOW_THRESHOLD = 50.0f;
    public static final double DEFAULT_ALTITUDE_THRESHOLD = 1000.0;

    // moving window: 3 days before, target day, 2 days after
    public static final int WINDOW_DAYS_BEFORE = 3;
    public static final int WINDOW_DAYS_AFTER = 2;
    public static final int WINDOW_SIZE = WINDOW_DAYS_BEFORE + 1 + WINDOW_DAYS_AFTER;

    public static final String DEFAULT_CLASS_TABLE_RESOURCE = "modis-snow-cover-classes.json";

    public static final String SHAPE_MISMATCH_ERROR_MESSAGE =
            "Input grids are not co-registered: all observation and class grids must share the shape " +
                    "[days, rows, columns] and the elevation grid must match [rows, columns].";

    public static final String UNKNOWN_METHOD_ERROR_MESSAGE = "Unknown %s '%s' - must be one of: %s";

    private SnowFillConstants() {
    }
}
