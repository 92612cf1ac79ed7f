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
package org.esa.snowfill.modis;

import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.stats.PixelCountsSnapshot;

/**
 * Grids and counters of a completed gap filling run. The final grid is the output of the run;
 * the fused and temporal grids are the intermediate results.
 */
public class GapFillResult {

    private final SnowCoverGrid fusedGrid;
    private final SnowCoverGrid temporalGrid;
    private final SnowCoverGrid finalGrid;
    private final PixelCountsSnapshot counts;

    public GapFillResult(SnowCoverGrid fusedGrid, SnowCoverGrid temporalGrid, SnowCoverGrid finalGrid,
                         PixelCountsSnapshot counts) {
        this.fusedGrid = fusedGrid;
        this.temporalGrid = temporalGrid;
        this.finalGrid = finalGrid;
        this.counts = counts;
    }

    public SnowCoverGrid getFusedGrid() {
        return fusedGrid;
    }

    public SnowCoverGrid getTemporalGrid() {
        return temporalGrid;
    }

    public SnowCoverGrid getFinalGrid() {
        return finalGrid;
    }

    public PixelCountsSnapshot getCounts() {
        return counts;
    }
}
