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
 * Temporal interpolation methods
 */
public enum InterpolationMethod {
    NEAREST("nearest"),
    LINEAR("linear"),
    CUBIC("cubic");

    private final String name;

    InterpolationMethod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static InterpolationMethod fromName(String name) {
        if (name != null) {
            final String key = name.trim().toLowerCase(Locale.ROOT);
            for (InterpolationMethod method : values()) {
                if (method.name.equals(key)) {
                    return method;
                }
            }
        }
        throw new GapFillException(String.format(SnowFillConstants.UNKNOWN_METHOD_ERROR_MESSAGE,
                                                 "interpolation method", name,
                                                 Arrays.toString(values())));
    }

    @Override
    public String toString() {
        return name;
    }
}
