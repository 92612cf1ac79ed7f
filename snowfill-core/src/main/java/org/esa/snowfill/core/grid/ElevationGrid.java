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

/**
 * Static elevation surface [rows, columns] in metres. NaN marks pixels without elevation.
 */
public class ElevationGrid {

    private final int height;
    private final int width;
    private final float[] elevation;

    public ElevationGrid(float[][] elevation) {
        this.height = elevation.length;
        this.width = height > 0 ? elevation[0].length : 0;
        this.elevation = new float[GridUtils.cellCount(1, height, width)];
        for (int y = 0; y < height; y++) {
            if (elevation[y].length != width) {
                throw new IllegalArgumentException("Ragged elevation array at row " + y);
            }
            System.arraycopy(elevation[y], 0, this.elevation, y * width, width);
        }
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public float get(int y, int x) {
        if (y < 0 || y >= height || x < 0 || x >= width) {
            throw new IndexOutOfBoundsException("[" + y + "," + x + "] outside elevation grid");
        }
        return elevation[y * width + x];
    }

    public boolean isDefined(int y, int x) {
        return !Float.isNaN(get(y, x));
    }
}
