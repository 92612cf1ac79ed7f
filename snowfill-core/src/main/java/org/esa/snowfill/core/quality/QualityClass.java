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
package org.esa.snowfill.core.quality;

import java.util.Arrays;

/**
 * A named category of quality class codes sharing one verdict, e.g. 'cloud' or 'snow-free land'.
 */
public class QualityClass {

    private final String name;
    private final QualityVerdict verdict;
    private final int[] codes;

    public QualityClass(String name, QualityVerdict verdict, int... codes) {
        if (name == null || verdict == null) {
            throw new IllegalArgumentException("Quality class needs a name and a verdict.");
        }
        this.name = name;
        this.verdict = verdict;
        this.codes = codes.clone();
    }

    public String getName() {
        return name;
    }

    public QualityVerdict getVerdict() {
        return verdict;
    }

    public int[] getCodes() {
        return codes.clone();
    }

    @Override
    public String toString() {
        return name + " " + Arrays.toString(codes) + " -> " + verdict;
    }
}
