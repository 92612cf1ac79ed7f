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

import org.esa.snowfill.core.grid.ClassCodeGrid;
import org.esa.snowfill.core.grid.ElevationGrid;
import org.esa.snowfill.core.grid.GridUtils;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.quality.QualityClassTable;
import org.esa.snowfill.core.quality.QualityClassifier;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.core.stats.PixelCountsSnapshot;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.fusion.FusionResult;
import org.esa.snowfill.modis.fusion.TerraAquaFusionOp;
import org.esa.snowfill.modis.spatial.SpatialCorrectionOp;
import org.esa.snowfill.modis.temporal.TemporalInterpolationOp;

import java.util.Map;
import java.util.logging.Level;

/**
 * Gap filling of daily MODIS snow cover. Runs the chain
 * <ol>
 * <li>Terra/Aqua fusion</li>
 * <li>temporal interpolation</li>
 * <li>spatial correction</li>
 * </ol>
 * and collects the pixel counters of all stages.
 */
public class ModisGapFillOp {

    private final ModisGapFillParameters parameters;

    /**
     * @param parameters - the run parameters
     * @throws org.esa.snowfill.core.GapFillException if the parameters are invalid
     */
    public ModisGapFillOp(ModisGapFillParameters parameters) {
        parameters.validate();
        this.parameters = parameters;
    }

    public ModisGapFillOp(Map<String, Object> parameters) {
        this(ModisGapFillParameters.fromMap(parameters));
    }

    public GapFillResult execute(SnowCoverGrid terra, SnowCoverGrid aqua,
                                 ClassCodeGrid terraClasses, ClassCodeGrid aquaClasses,
                                 ElevationGrid elevation) {
        return execute(terra, aqua, terraClasses, aquaClasses, elevation, null);
    }

    /**
     * Runs the gap filling.
     *
     * @param terra - Terra snow cover [days, rows, columns]
     * @param aqua - Aqua snow cover [days, rows, columns]
     * @param terraClasses - Terra quality class codes
     * @param aquaClasses - Aqua quality class codes
     * @param elevation - elevation [rows, columns]
     * @param studyAreaMask - pixels to process [rows][columns], may be null
     * @return the result
     * @throws org.esa.snowfill.core.GapFillException if the grids are inconsistent or a stage fails
     */
    public GapFillResult execute(SnowCoverGrid terra, SnowCoverGrid aqua,
                                 ClassCodeGrid terraClasses, ClassCodeGrid aquaClasses,
                                 ElevationGrid elevation, boolean[][] studyAreaMask) {
        GridUtils.validateShapes(terra, aqua, terraClasses, aquaClasses, elevation);
        final StudyAreaMask studyArea = StudyAreaMask.create(elevation, studyAreaMask);
        final int numDays = terra.getNumDays();
        final int numWorkers = parameters.getNumWorkers();

        final long estimate = SnowFillUtils.estimateMemoryBytes(numDays, terra.getHeight(), terra.getWidth());
        SnowFillUtils.LOG.info("Gap filling " + numDays + " days of " + terra.getHeight() + " x " +
                                       terra.getWidth() + " pixels (" + studyArea.countInside() +
                                       " in study area), estimated memory " + SnowFillUtils.formatBytes(estimate) +
                                       ", " + numWorkers + " workers");
        if (estimate > Runtime.getRuntime().maxMemory()) {
            SnowFillUtils.LOG.warning("Estimated memory " + SnowFillUtils.formatBytes(estimate) +
                                              " exceeds maximum heap " +
                                              SnowFillUtils.formatBytes(Runtime.getRuntime().maxMemory()));
        }

        final QualityClassTable classTable = parameters.getClassTable() != null ?
                parameters.getClassTable() : QualityClassTable.createDefault();
        final TerraAquaFusionOp fusionOp = new TerraAquaFusionOp(new QualityClassifier(classTable), numWorkers);
        final FusionResult fusion = fusionOp.fuse(terra, aqua, terraClasses, aquaClasses, studyArea);

        final TemporalInterpolationOp temporalOp =
                new TemporalInterpolationOp(parameters.getInterpolationMethod(), numWorkers);
        final StageResult temporal = temporalOp.interpolate(fusion.getGrid(), studyArea);

        final SpatialCorrectionOp spatialOp = new SpatialCorrectionOp(parameters.createSpatialCorrection(),
                                                                      parameters.getSnowValue(), numWorkers);
        final StageResult spatial = spatialOp.correct(temporal.getGrid(), fusion.getVerdicts(), elevation,
                                                      studyArea);

        final PixelCounts counts = new PixelCounts(numDays);
        counts.add(fusion.getCounts());
        counts.add(temporal.getCounts());
        counts.add(spatial.getCounts());
        final PixelCountsSnapshot snapshot = counts.snapshot();

        if (!snapshot.isConsistent()) {
            SnowFillUtils.LOG.log(Level.WARNING, "Pixel counters do not add up: " + snapshot);
        }
        SnowFillUtils.LOG.info("Gap filling done: " + snapshot.get(PixelCounter.TOTAL) + " pixel-days, " +
                                       snapshot.get(PixelCounter.FINAL_REMAINING_GAP) + " remaining gaps");
        return new GapFillResult(fusion.getGrid(), temporal.getGrid(), spatial.getGrid(), snapshot);
    }

    public ModisGapFillParameters getParameters() {
        return parameters;
    }
}
