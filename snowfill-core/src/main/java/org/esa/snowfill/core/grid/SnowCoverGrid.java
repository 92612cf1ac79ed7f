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
package org.esa.snowfill.core.grid;

import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.util.SnowFillUtils;

import java.util.Arrays;

/**
 * Snow cover values [days, rows, columns]. Every cell holds either a concrete value in [0,100]
 * or the no-data marker. A cell may be resolved once; later writes to a resolved cell are rejected.
 */
public class SnowCoverGrid {

    private final int numDays;
    private final int height;
    private final int width;
    private final float[] data;

    public SnowCoverGrid(int numDays, int height, int width) {
        if (numDays < 0 || height < 0 || width < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative.");
        }
        this.numDays = numDays;
        this.height = height;
        this.width = width;
        this.data = new float[GridUtils.cellCount(numDays, height, width)];
        Arrays.fill(data, SnowFillConstants.NO_DATA_VALUE);
    }

    private SnowCoverGrid(SnowCoverGrid other) {
        this.numDays = other.numDays;
        this.height = other.height;
        this.width = other.width;
        this.data = other.data.clone();
    }

    /**
     * Wraps raw observations. Values outside [0,100] are taken as no-data.
     *
     * @param values - raw values [days][rows][columns]
     * @return the grid
     */
    public static SnowCoverGrid of(float[][][] values) {
        final int numDays = values.length;
        final int height = numDays > 0 ? values[0].length : 0;
        final int width = height > 0 ? values[0][0].length : 0;
        final SnowCoverGrid grid = new SnowCoverGrid(numDays, height, width);
        for (int t = 0; t < numDays; t++) {
            if (values[t].length != height) {
                throw new IllegalArgumentException("Ragged observation array at day " + t);
            }
            for (int y = 0; y < height; y++) {
                if (values[t][y].length != width) {
                    throw new IllegalArgumentException("Ragged observation array at day " + t + ", row " + y);
                }
                for (int x = 0; x < width; x++) {
                    final float v = values[t][y][x];
                    if (SnowFillUtils.isConcrete(v)) {
                        grid.data[grid.index(t, y, x)] = v;
                    }
                }
            }
        }
        return grid;
    }

    public int getNumDays() {
        return numDays;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public float get(int day, int y, int x) {
        return data[index(day, y, x)];
    }

    public boolean isResolved(int day, int y, int x) {
        return !Float.isNaN(data[index(day, y, x)]);
    }

    public void resolve(int day, int y, int x, float value) {
        if (!SnowFillUtils.isConcrete(value)) {
            throw new IllegalArgumentException("Snow cover value " + value + " at [" + day + "," + y + "," + x +
                                                       "] is not within [0,100].");
        }
        final int index = index(day, y, x);
        if (!Float.isNaN(data[index])) {
            throw new IllegalStateException("Cell [" + day + "," + y + "," + x + "] is already resolved.");
        }
        data[index] = value;
    }

    public SnowCoverGrid copy() {
        return new SnowCoverGrid(this);
    }

    public long countResolved() {
        long count = 0;
        for (float v : data) {
            if (!Float.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    public float[][][] toArray() {
        final float[][][] values = new float[numDays][height][width];
        for (int t = 0; t < numDays; t++) {
            for (int y = 0; y < height; y++) {
                System.arraycopy(data, index(t, y, 0), values[t][y], 0, width);
            }
        }
        return values;
    }

    private int index(int day, int y, int x) {
        if (day < 0 || day >= numDays || y < 0 || y >= height || x < 0 || x >= width) {
            throw new IndexOutOfBoundsException("[" + day + "," + y + "," + x + "] outside grid [" +
                                                        numDays + "," + height + "," + width + "]");
        }
        return (day * height + y) * width + x;
    }
}
