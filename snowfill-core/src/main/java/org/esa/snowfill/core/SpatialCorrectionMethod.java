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
package org.esa.snowfill.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Spatial correction methods. The legacy names 'old' and 'new' denote
 * {@link #ELEVATION_MEAN} and {@link #NEIGHBOR_BASED}.
 */
public enum SpatialCorrectionMethod {
    ELEVATION_MEAN("elevation_mean", "old"),
    NEIGHBOR_BASED("neighbor_based", "new"),
    NONE("none", null);

    private final String name;
    private final String legacyName;

    SpatialCorrectionMethod(String name, String legacyName) {
        this.name = name;
        this.legacyName = legacyName;
    }

    public String getName() {
        return name;
    }

    public static SpatialCorrectionMethod fromName(String name) {
        if (name != null) {
            final String key = name.trim().toLowerCase(Locale.ROOT);
            for (SpatialCorrectionMethod method : values()) {
                if (method.name.equals(key) || key.equals(method.legacyName)) {
                    return method;
                }
            }
        }
        throw new GapFillException(String.format(SnowFillConstants.UNKNOWN_METHOD_ERROR_MESSAGE,
                                                 "spatial correction method", name,
                                                 Arrays.toString(values())));
    }

    @Override
    public String toString() {
        return name;
    }
}
