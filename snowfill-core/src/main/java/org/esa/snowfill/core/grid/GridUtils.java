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

import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.SnowFillConstants;

/**
 * Shape checks for co-registered grids.
 */
public class GridUtils {

    private GridUtils() {
    }

    /**
     * Checks that the observation and class grids of both sensors share one shape.
     *
     * @throws GapFillException if the shapes differ
     */
    public static void validateObservationShapes(SnowCoverGrid primary, SnowCoverGrid secondary,
                                                 ClassCodeGrid primaryClasses, ClassCodeGrid secondaryClasses) {
        final int numDays = primary.getNumDays();
        final int height = primary.getHeight();
        final int width = primary.getWidth();
        if (!hasShape(secondary, numDays, height, width) ||
                !hasShape(primaryClasses, numDays, height, width) ||
                !hasShape(secondaryClasses, numDays, height, width)) {
            throw new GapFillException(SnowFillConstants.SHAPE_MISMATCH_ERROR_MESSAGE + " Found: " +
                                               describe(numDays, height, width) + ", " +
                                               describe(secondary.getNumDays(), secondary.getHeight(),
                                                        secondary.getWidth()) + ", " +
                                               describe(primaryClasses.getNumDays(), primaryClasses.getHeight(),
                                                        primaryClasses.getWidth()) + ", " +
                                               describe(secondaryClasses.getNumDays(), secondaryClasses.getHeight(),
                                                        secondaryClasses.getWidth()));
        }
    }

    public static void validateShapes(SnowCoverGrid primary, SnowCoverGrid secondary,
                                      ClassCodeGrid primaryClasses, ClassCodeGrid secondaryClasses,
                                      ElevationGrid elevation) {
        validateObservationShapes(primary, secondary, primaryClasses, secondaryClasses);
        if (elevation.getHeight() != primary.getHeight() || elevation.getWidth() != primary.getWidth()) {
            throw new GapFillException(SnowFillConstants.SHAPE_MISMATCH_ERROR_MESSAGE + " Found: " +
                                               describe(primary.getNumDays(), primary.getHeight(),
                                                        primary.getWidth()) + ", elevation [" +
                                               elevation.getHeight() + ", " + elevation.getWidth() + "]");
        }
    }

    public static void validateStudyArea(StudyAreaMask studyArea, int height, int width) {
        if (studyArea.getHeight() != height || studyArea.getWidth() != width) {
            throw new GapFillException("Dimensions of study area [" + studyArea.getHeight() + ", " +
                                               studyArea.getWidth() + "] differ from input grids [" + height +
                                               ", " + width + "]. Please check.");
        }
    }

    /**
     * Number of cells of a [days, rows, columns] grid held in a single array.
     *
     * @throws GapFillException if the grid has more cells than an array can index
     */
    public static int cellCount(int numDays, int height, int width) {
        try {
            final long count = Math.multiplyExact(Math.multiplyExact((long) numDays, (long) height), (long) width);
            if (count > Integer.MAX_VALUE) {
                throw new GapFillException(tooLargeMessage(numDays, height, width));
            }
            return (int) count;
        } catch (ArithmeticException e) {
            throw new GapFillException(tooLargeMessage(numDays, height, width), e);
        }
    }

    public static void validateMaskShape(boolean[][] mask, int height, int width) {
        if (mask == null) {
            return;
        }
        boolean matches = mask.length == height;
        for (int y = 0; matches && y < mask.length; y++) {
            matches = mask[y].length == width;
        }
        if (!matches) {
            throw new GapFillException("Dimensions of study area mask differ from input grids. Please check.");
        }
    }

    private static boolean hasShape(SnowCoverGrid grid, int numDays, int height, int width) {
        return grid.getNumDays() == numDays && grid.getHeight() == height && grid.getWidth() == width;
    }

    private static boolean hasShape(ClassCodeGrid grid, int numDays, int height, int width) {
        return grid.getNumDays() == numDays && grid.getHeight() == height && grid.getWidth() == width;
    }

    private static String tooLargeMessage(int numDays, int height, int width) {
        return "Grid " + describe(numDays, height, width) + " exceeds " + Integer.MAX_VALUE +
                " cells. Please split the input into smaller tiles or periods.";
    }

    private static String describe(int numDays, int height, int width) {
        return "[" + numDays + ", " + height + ", " + width + "]";
    }
}
