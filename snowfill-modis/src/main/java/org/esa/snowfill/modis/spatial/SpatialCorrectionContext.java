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
package org.esa.snowfill.modis.spatial;

import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.modis.fusion.VerdictGrid;

/**
 * Read-only inputs of the spatial correction.
 */
public class SpatialCorrectionContext {

    private final SnowCoverGrid grid;
    private final VerdictGrid verdicts;
    private final ElevationGrid elevation;
    private final StudyAreaMask studyArea;

    /**
     * @param grid - the grid before spatial correction
     * @param verdicts - the verdicts of the fused observations
     * @param elevation - the elevation grid
     * @param studyArea - the study area
     */
    public SpatialCorrectionContext(SnowCoverGrid grid, VerdictGrid verdicts,
                                    ElevationGrid elevation, StudyAreaMask studyArea) {
        this.grid = grid;
        this.verdicts = verdicts;
        this.elevation = elevation;
        this.studyArea = studyArea;
    }

    public SnowCoverGrid getGrid() {
        return grid;
    }

    public VerdictGrid getVerdicts() {
        return verdicts;
    }

    public ElevationGrid getElevation() {
        return elevation;
    }

    public StudyAreaMask getStudyArea() {
        return studyArea;
    }
}
