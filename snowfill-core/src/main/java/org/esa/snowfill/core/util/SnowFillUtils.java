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
package org.esa.snowfill.core.util;

import org.esa.snowfill.core.SnowFillConstants;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Utility class for SnowFill
 */
public class SnowFillUtils {

    public static final Logger LOG = Logger.getLogger("snowfill");

    // bytes per cell: observation and class grids for two sensors, fused, temporal and final grids, verdicts
    private static final long BYTES_PER_PIXEL_DAY = 2 * 4 + 2 * 4 + 3 * 4 + 1;
    private static final long BYTES_PER_PIXEL = 8 + 1;

    private SnowFillUtils() {
    }

    /**
     * Checks whether a value is a concrete snow cover value, i.e. not the no-data marker and within [0,100].
     *
     * @param value - the value
     * @return boolean
     */
    public static boolean isConcrete(float value) {
        return !Float.isNaN(value) &&
                value >= SnowFillConstants.MIN_SNOW_COVER_VALUE &&
                value <= SnowFillConstants.MAX_SNOW_COVER_VALUE;
    }

    public static float clampToValidRange(double value) {
        if (value < SnowFillConstants.MIN_SNOW_COVER_VALUE) {
            return SnowFillConstants.MIN_SNOW_COVER_VALUE;
        }
        if (value > SnowFillConstants.MAX_SNOW_COVER_VALUE) {
            return SnowFillConstants.MAX_SNOW_COVER_VALUE;
        }
        return (float) value;
    }

    /**
     * Provides a rough estimate of the heap needed for one gap filling run.
     *
     * @param numDays - length of the time axis
     * @param height - number of rows
     * @param width - number of columns
     * @return estimated number of bytes
     */
    public static long estimateMemoryBytes(int numDays, int height, int width) {
        final long pixels = (long) height * width;
        return pixels * numDays * BYTES_PER_PIXEL_DAY + pixels * BYTES_PER_PIXEL;
    }

    public static String formatBytes(long bytes) {
        final double mib = bytes / (1024.0 * 1024.0);
        if (mib >= 1024.0) {
            return String.format(Locale.ROOT, "%.2f GiB", mib / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MiB", mib);
    }
}
