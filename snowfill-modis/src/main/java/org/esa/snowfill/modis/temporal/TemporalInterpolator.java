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
package org.esa.snowfill.modis.temporal;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.fitting.PolynomialFitter;
import org.apache.commons.math3.optim.nonlinear.vector.jacobian.LevenbergMarquardtOptimizer;
import org.esa.snowfill.core.InterpolationMethod;
import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.util.SnowFillUtils;
import org.esa.snowfill.modis.ModisSnowFillConstants;

/**
 * Estimates a missing value from the valid values in its temporal window. The points are given
 * as day offsets relative to the target day (never 0) and their values.
 * <p>
 * Not thread safe: the cubic fitter keeps state, so each worker uses its own instance.
 */
public class TemporalInterpolator {

    private final InterpolationMethod method;
    private final PolynomialFitter curveFitter;
    private InterpolationMethod appliedMethod;

    public TemporalInterpolator(InterpolationMethod method) {
        this.method = method;
        this.curveFitter = new PolynomialFitter(new LevenbergMarquardtOptimizer());
    }

    public InterpolationMethod getMethod() {
        return method;
    }

    /**
     * @return the method used by the last call to {@link #interpolate}, including a fallback
     * after a failed cubic fit, or null if that call had no valid point
     */
    public InterpolationMethod getAppliedMethod() {
        return appliedMethod;
    }

    /**
     * Determines the method to apply for the given points, following the fallback
     * chain cubic, linear, nearest.
     *
     * @param offsets - day offsets of the valid points
     * @param n - number of valid points
     * @return the applicable method, or null if there is no valid point
     */
    public InterpolationMethod resolveMethod(int[] offsets, int n) {
        if (n == 0) {
            return null;
        }
        if (method == InterpolationMethod.CUBIC && n >= ModisSnowFillConstants.CUBIC_MIN_POINTS) {
            return InterpolationMethod.CUBIC;
        }
        if (method != InterpolationMethod.NEAREST && n >= 2 && straddles(offsets, n)) {
            return InterpolationMethod.LINEAR;
        }
        return InterpolationMethod.NEAREST;
    }

    /**
     * @param offsets - day offsets of the valid points
     * @param values - values of the valid points
     * @param n - number of valid points
     * @return the estimate clamped to [0,100], or the no-data value if there is no valid point
     */
    public float interpolate(int[] offsets, float[] values, int n) {
        appliedMethod = resolveMethod(offsets, n);
        if (appliedMethod == null) {
            return SnowFillConstants.NO_DATA_VALUE;
        }
        switch (appliedMethod) {
            case CUBIC:
                return SnowFillUtils.clampToValidRange(cubic(offsets, values, n));
            case LINEAR:
                return SnowFillUtils.clampToValidRange(linear(offsets, values, n));
            default:
                return SnowFillUtils.clampToValidRange(values[nearestIndex(offsets, n)]);
        }
    }

    static boolean straddles(int[] offsets, int n) {
        boolean past = false;
        boolean future = false;
        for (int i = 0; i < n; i++) {
            past |= offsets[i] < 0;
            future |= offsets[i] > 0;
        }
        return past && future;
    }

    static int nearestIndex(int[] offsets, int n) {
        int best = -1;
        for (int i = 0; i < n; i++) {
            if (best < 0) {
                best = i;
                continue;
            }
            final int distance = Math.abs(offsets[i]);
            final int bestDistance = Math.abs(offsets[best]);
            // on equal distance the past value wins
            if (distance < bestDistance || (distance == bestDistance && offsets[i] < offsets[best])) {
                best = i;
            }
        }
        return best;
    }

    static double linear(int[] offsets, float[] values, int n) {
        int past = -1;
        int future = -1;
        for (int i = 0; i < n; i++) {
            if (offsets[i] < 0 && (past < 0 || offsets[i] > offsets[past])) {
                past = i;
            } else if (offsets[i] > 0 && (future < 0 || offsets[i] < offsets[future])) {
                future = i;
            }
        }
        final double span = offsets[future] - offsets[past];
        final double weight = -offsets[past] / span;
        return values[past] + weight * (values[future] - values[past]);
    }

    private double cubic(int[] offsets, float[] values, int n) {
        try {
            return fitCubic(offsets, values, n);
        } catch (ConvergenceException | TooManyEvaluationsException e) {
            if (straddles(offsets, n)) {
                SnowFillUtils.LOG.fine("Cubic fit did not converge, using linear interpolation: " + e.getMessage());
                appliedMethod = InterpolationMethod.LINEAR;
                return linear(offsets, values, n);
            }
            SnowFillUtils.LOG.fine("Cubic fit did not converge, using nearest value: " + e.getMessage());
            appliedMethod = InterpolationMethod.NEAREST;
            return values[nearestIndex(offsets, n)];
        }
    }

    /**
     * @return the least squares cubic evaluated at offset 0
     */
    double fitCubic(int[] offsets, float[] values, int n) {
        curveFitter.clearObservations();
        for (int i = 0; i < n; i++) {
            curveFitter.addObservedPoint(offsets[i], values[i]);
        }
        return curveFitter.fit(ModisSnowFillConstants.CUBIC_FIT_INITIAL)[0];
    }
}
