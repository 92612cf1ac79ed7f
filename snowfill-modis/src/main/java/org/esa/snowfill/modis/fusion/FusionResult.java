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

import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.modis.StageResult;

/**
 * Fused grid, the verdicts behind it and the fusion counters.
 */
public class FusionResult extends StageResult {

    private final VerdictGrid verdicts;

    public FusionResult(SnowCoverGrid grid, VerdictGrid verdicts, PixelCounts counts) {
        super(grid, counts);
        this.verdicts = verdicts;
    }

    public VerdictGrid getVerdicts() {
        return verdicts;
    }
}
