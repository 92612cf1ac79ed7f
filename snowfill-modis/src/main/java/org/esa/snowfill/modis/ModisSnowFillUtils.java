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

import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.stats.PixelCounts;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Utility class for the MODIS gap filling stages
 */
public class ModisSnowFillUtils {

    private ModisSnowFillUtils() {
    }

    /**
     * Splits the grid bounds into horizontal slices.
     *
     * @param width - grid width
     * @param height - grid height
     * @param numSlices - the requested number of slices
     * @return slices covering all rows, each with at least one row
     */
    public static List<Rectangle> sliceRows(int width, int height, int numSlices) {
        final List<Rectangle> slices = new ArrayList<>();
        if (width <= 0 || height <= 0) {
            return slices;
        }
        final Rectangle bounds = new Rectangle(0, 0, width, height);
        final int sliceHeight = Math.max(1, (height + numSlices - 1) / Math.max(1, numSlices));
        for (int i = 0; i < height; i += sliceHeight) {
            final Rectangle slice = bounds.intersection(new Rectangle(0, i, width, sliceHeight));
            if (!slice.isEmpty()) {
                slices.add(slice);
            }
        }
        return slices;
    }

    /**
     * Runs the tasks on a fixed thread pool and merges the counts they return.
     *
     * @param tasks - the tasks, each returning its own counts
     * @param numWorkers - number of threads
     * @param numDays - length of the time axis
     * @return merged counts
     * @throws GapFillException if a task fails or the run is interrupted
     */
    public static PixelCounts runTasks(List<Callable<PixelCounts>> tasks, int numWorkers, int numDays) {
        final PixelCounts counts = new PixelCounts(numDays);
        if (tasks.isEmpty()) {
            return counts;
        }
        final ExecutorService executorService = Executors.newFixedThreadPool(Math.max(1, Math.min(numWorkers,
                                                                                                  tasks.size())));
        try {
            final List<Future<PixelCounts>> futures = new ArrayList<>();
            for (Callable<PixelCounts> task : tasks) {
                futures.add(executorService.submit(task));
            }
            for (Future<PixelCounts> future : futures) {
                counts.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GapFillException("Gap filling was interrupted", e);
        } catch (ExecutionException e) {
            throw new GapFillException("Gap filling task failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executorService.shutdownNow();
        }
        return counts;
    }
}
