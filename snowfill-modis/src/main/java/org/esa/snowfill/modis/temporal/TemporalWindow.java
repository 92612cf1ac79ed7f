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

import org.esa.snowfill.core.SnowFillConstants;

/**
 * Moving window around a target day, clamped to the bounds of the time series.
 */
public class TemporalWindow {

    private final int firstDay;
    private final int lastDay;

    private TemporalWindow(int firstDay, int lastDay) {
        this.firstDay = firstDay;
        this.lastDay = lastDay;
    }

    public static TemporalWindow around(int day, int numDays) {
        return around(day, numDays, SnowFillConstants.WINDOW_DAYS_BEFORE, SnowFillConstants.WINDOW_DAYS_AFTER);
    }

    public static TemporalWindow around(int day, int numDays, int daysBefore, int daysAfter) {
        if (day < 0 || day >= numDays) {
            throw new IllegalArgumentException("Day " + day + " outside time series of " + numDays + " days");
        }
        return new TemporalWindow(Math.max(0, day - daysBefore), Math.min(numDays - 1, day + daysAfter));
    }

    public int getFirstDay() {
        return firstDay;
    }

    // inclusive
    public int getLastDay() {
        return lastDay;
    }

    public int size() {
        return lastDay - firstDay + 1;
    }
}
