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
package org.esa.snowfill.core.stats;

/**
 * Named pixel-day counters recorded during a gap filling run
 */
public enum PixelCounter {
    TOTAL("total"),
    OUTSIDE_STUDY_AREA("outside_study_area"),
    PRIMARY_SOURCED("primary_sourced"),
    SECONDARY_SOURCED("secondary_sourced"),
    UNRESOLVED_AFTER_FUSION("unresolved_after_fusion"),
    INTERPOLATED("interpolated"),
    INTERPOLATED_CUBIC("interpolated_cubic"),
    INTERPOLATED_LINEAR("interpolated_linear"),
    INTERPOLATED_NEAREST("interpolated_nearest"),
    REMAINING_GAP_AFTER_TEMPORAL("remaining_gap_after_temporal"),
    SPATIALLY_CORRECTED("spatially_corrected"),
    SPATIALLY_CORRECTED_SNOW("spatially_corrected_snow"),
    SPATIALLY_CORRECTED_NO_SNOW("spatially_corrected_no_snow"),
    FINAL_REMAINING_GAP("final_remaining_gap");

    private final String label;

    PixelCounter(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
