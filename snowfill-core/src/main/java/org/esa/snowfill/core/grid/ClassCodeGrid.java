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
 * Quality class codes [days, rows, columns] of one sensor. Immutable.
 */
public class ClassCodeGrid {

    private final int numDays;
    private final int height;
    private final int width;
    private final int[] codes;

    public ClassCodeGrid(int[][][] codes) {
        this.numDays = codes.length;
        this.height = numDays > 0 ? codes[0].length : 0;
        this.width = height > 0 ? codes[0][0].length : 0;
        this.codes = new int[GridUtils.cellCount(numDays, height, width)];
        for (int t = 0; t < numDays; t++) {
            for (int y = 0; y < height; y++) {
                if (codes[t].length != height || codes[t][y].length != width) {
                    throw new IllegalArgumentException("Ragged class code array at day " + t);
                }
                System.arraycopy(codes[t][y], 0, this.codes, (t * height + y) * width, width);
            }
        }
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

    public int get(int day, int y, int x) {
        if (day < 0 || day >= numDays || y < 0 || y >= height || x < 0 || x >= width) {
            throw new IndexOutOfBoundsException("[" + day + "," + y + "," + x + "] outside class grid");
        }
        return codes[(day * height + y) * width + x];
    }
}
