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

/**
 * Classifies quality class codes into verdicts. Pure and total: unknown codes are invalid.
 */
public class QualityClassifier {

    private static final int LOOKUP_SIZE = 256;

    private final QualityClassTable table;
    private final QualityVerdict[] lookup;

    public QualityClassifier(QualityClassTable table) {
        this.table = table;
        this.lookup = new QualityVerdict[LOOKUP_SIZE];
        for (int code = 0; code < LOOKUP_SIZE; code++) {
            lookup[code] = table.getVerdict(code);
        }
    }

    public static QualityClassifier createDefault() {
        return new QualityClassifier(QualityClassTable.createDefault());
    }

    public QualityVerdict classify(int code) {
        if (code >= 0 && code < LOOKUP_SIZE) {
            return lookup[code];
        }
        return table.getVerdict(code);
    }

    public QualityClassTable getTable() {
        return table;
    }
}
