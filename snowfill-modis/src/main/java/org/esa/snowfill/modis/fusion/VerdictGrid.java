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
package org.esa.snowfill.modis.fusion;

import org.esa.snowfill.core.grid.GridUtils;
import org.esa.snowfill.core.quality.QualityVerdict;

import java.util.Arrays;

/**
 * Per cell verdict of the observation selected by the fusion. Cells without a selected observation hold null.
 */
public class VerdictGrid {

    private static final byte NONE = -1;
    private static final QualityVerdict[] VERDICTS = QualityVerdict.values();

    private final int numDays;
    private final int height;
    private final int width;
    private final byte[] verdicts;

    public VerdictGrid(int numDays, int height, int width) {
        this.numDays = numDays;
        this.height = height;
        this.width = width;
        this.verdicts = new byte[GridUtils.cellCount(numDays, height, width)];
        Arrays.fill(verdicts, NONE);
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

    public QualityVerdict get(int day, int y, int x) {
        final byte v = verdicts[(day * height + y) * width + x];
        return v == NONE ? null : VERDICTS[v];
    }

    void set(int day, int y, int x, QualityVerdict verdict) {
        verdicts[(day * height + y) * width + x] = (byte) verdict.ordinal();
    }
}
