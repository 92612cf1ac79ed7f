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
 * Marks the pixels belonging to the processed area. A pixel is inside if the optional
 * mask marks it and its elevation is defined.
 */
public class StudyAreaMask {

    private final int height;
    private final int width;
    private final boolean[] inside;

    private StudyAreaMask(int height, int width, boolean[] inside) {
        this.height = height;
        this.width = width;
        this.inside = inside;
    }

    /**
     * Creates the study area from an elevation grid and an optional mask.
     *
     * @param elevation - the elevation grid
     * @param mask - the mask [rows][columns], may be null
     * @return the study area
     * @throws org.esa.snowfill.core.GapFillException if the mask does not match the elevation grid
     */
    public static StudyAreaMask create(ElevationGrid elevation, boolean[][] mask) {
        final int height = elevation.getHeight();
        final int width = elevation.getWidth();
        GridUtils.validateMaskShape(mask, height, width);
        final boolean[] inside = new boolean[GridUtils.cellCount(1, height, width)];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final boolean masked = mask == null || mask[y][x];
                inside[y * width + x] = masked && elevation.isDefined(y, x);
            }
        }
        return new StudyAreaMask(height, width, inside);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public boolean isInside(int y, int x) {
        return inside[y * width + x];
    }

    public long countInside() {
        long count = 0;
        for (boolean b : inside) {
            if (b) {
                count++;
            }
        }
        return count;
    }
}
