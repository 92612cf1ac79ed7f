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

import org.esa.snowfill.core.grid.ClassCodeGrid;
import org.esa.snowfill.core.grid.GridUtils;
import org.esa.snowfill.core.grid.SnowCoverGrid;
import org.esa.snowfill.core.grid.StudyAreaMask;
import org.esa.snowfill.core.quality.QualityClassifier;
import org.esa.snowfill.core.quality.QualityVerdict;
import org.esa.snowfill.core.stats.PixelCounter;
import org.esa.snowfill.core.stats.PixelCounts;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.ModisSnowFillUtils;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Merges the daily Terra (primary) and Aqua (secondary) snow cover into one grid.
 * Per pixel-day the Terra observation is taken if its class is valid and its value usable,
 * otherwise the Aqua observation under the same condition, otherwise the cell stays a gap.
 */
public class TerraAquaFusionOp {

    private final QualityClassifier classifier;
    private final int numWorkers;

    public TerraAquaFusionOp(QualityClassifier classifier, int numWorkers) {
        this.classifier = classifier;
        this.numWorkers = numWorkers;
    }

    public FusionResult fuse(SnowCoverGrid terra, SnowCoverGrid aqua,
                             ClassCodeGrid terraClasses, ClassCodeGrid aquaClasses,
                             StudyAreaMask studyArea) {
        final int numDays = terra.getNumDays();
        final int height = terra.getHeight();
        final int width = terra.getWidth();
        GridUtils.validateObservationShapes(terra, aqua, terraClasses, aquaClasses);
        GridUtils.validateStudyArea(studyArea, height, width);
        SnowFillUtils.LOG.info("Fusing Terra and Aqua snow cover for " + numDays + " days");

        final SnowCoverGrid fused = new SnowCoverGrid(numDays, height, width);
        final VerdictGrid verdicts = new VerdictGrid(numDays, height, width);

        final List<Callable<PixelCounts>> tasks = new ArrayList<>();
        for (Rectangle slice : ModisSnowFillUtils.sliceRows(width, height, numWorkers)) {
            tasks.add(() -> {
                final PixelCounts counts = new PixelCounts(numDays);
                for (int t = 0; t < numDays; t++) {
                    for (int y = slice.y; y < slice.y + slice.height; y++) {
                        for (int x = slice.x; x < slice.x + slice.width; x++) {
                            if (!studyArea.isInside(y, x)) {
                                counts.increment(PixelCounter.OUTSIDE_STUDY_AREA, t);
                                continue;
                            }
                            counts.increment(PixelCounter.TOTAL, t);
                            final QualityVerdict terraVerdict = classifier.classify(terraClasses.get(t, y, x));
                            final QualityVerdict aquaVerdict = classifier.classify(aquaClasses.get(t, y, x));
                            if (terraVerdict.isValid() && terra.isResolved(t, y, x)) {
                                fused.resolve(t, y, x, terra.get(t, y, x));
                                verdicts.set(t, y, x, terraVerdict);
                                counts.increment(PixelCounter.PRIMARY_SOURCED, t);
                            } else if (aquaVerdict.isValid() && aqua.isResolved(t, y, x)) {
                                fused.resolve(t, y, x, aqua.get(t, y, x));
                                verdicts.set(t, y, x, aquaVerdict);
                                counts.increment(PixelCounter.SECONDARY_SOURCED, t);
                            } else {
                                counts.increment(PixelCounter.UNRESOLVED_AFTER_FUSION, t);
                            }
                        }
                    }
                }
                return counts;
            });
        }
        final PixelCounts counts = ModisSnowFillUtils.runTasks(tasks, numWorkers, numDays);
        SnowFillUtils.LOG.info("Fusion: " + counts.get(PixelCounter.PRIMARY_SOURCED) + " Terra, " +
                                       counts.get(PixelCounter.SECONDARY_SOURCED) + " Aqua, " +
                                       counts.get(PixelCounter.UNRESOLVED_AFTER_FUSION) + " gaps");
        return new FusionResult(fused, verdicts, counts);
    }
}
