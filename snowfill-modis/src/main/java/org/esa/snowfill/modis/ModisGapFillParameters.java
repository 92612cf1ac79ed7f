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

import org.apache.commons.lang3.Range;
import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.InterpolationMethod;
import org.esa.snowfill.core.SnowFillConstants;
import org.esa.snowfill.core.SpatialCorrectionMethod;
import org.esa.snowfill.core.quality.QualityClassTable;
import org.esa.snowfill.modis.spatial.ElevationMeanCorrection;
import org.esa.snowfill.modis.spatial.NeighborBasedCorrection;
import org.esa.snowfill.modis.spatial.NoSpatialCorrection;
import org.esa.snowfill.modis.spatial.SpatialCorrection;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Parameters of a MODIS gap filling run. Unset parameters keep their defaults.
 * Parameters can be given as a map keyed by parameter name or as a JSON object with the same keys.
 */
public class ModisGapFillParameters {

    private static final Range<Float> SNOW_COVER_RANGE =
            Range.between(SnowFillConstants.MIN_SNOW_COVER_VALUE, SnowFillConstants.MAX_SNOW_COVER_VALUE);
    private static final Range<Double> ALTITUDE_RANGE = Range.between(0.0, Double.MAX_VALUE);
    private static final Range<Double> RATIO_RANGE = Range.between(0.0, 1.0);
    private static final Range<Integer> COUNT_RANGE = Range.between(1, Integer.MAX_VALUE);

    private InterpolationMethod interpolationMethod = InterpolationMethod.NEAREST;
    private SpatialCorrectionMethod spatialCorrectionMethod = SpatialCorrectionMethod.ELEVATION_MEAN;
    private double altitudeThreshold = SnowFillConstants.DEFAULT_ALTITUDE_THRESHOLD;
    private float snowValue = SnowFillConstants.DEFAULT_SNOW_VALUE;
    private float noSnowValue = SnowFillConstants.DEFAULT_NO_SNOW_VALUE;
    private float snowThreshold = SnowFillConstants.DEFAULT_SNOW_THRESHOLD;
    private int minSnowSampleCount = ModisSnowFillConstants.DEFAULT_MIN_SNOW_SAMPLE_COUNT;
    private double maxHighElevationGapRatio = ModisSnowFillConstants.DEFAULT_MAX_HIGH_ELEVATION_GAP_RATIO;
    private int numWorkers = Runtime.getRuntime().availableProcessors();
    private QualityClassTable classTable;

    /**
     * Creates parameters from a map of parameter names to values. Method names and numbers may be given
     * as strings. The class table is given either as {@link QualityClassTable} ('classTable') or as
     * a JSON file ('classTableFile').
     *
     * @param parameters - the parameter map
     * @return the parameters
     * @throws GapFillException on unknown parameters or values of the wrong type
     */
    public static ModisGapFillParameters fromMap(Map<String, Object> parameters) {
        final ModisGapFillParameters p = new ModisGapFillParameters();
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            final String key = entry.getKey();
            final Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case ModisSnowFillConstants.INTERPOLATION_METHOD_PARAM:
                    p.setInterpolationMethod(value instanceof InterpolationMethod ? (InterpolationMethod) value
                                                     : InterpolationMethod.fromName(value.toString()));
                    break;
                case ModisSnowFillConstants.SPATIAL_CORRECTION_METHOD_PARAM:
                    p.setSpatialCorrectionMethod(value instanceof SpatialCorrectionMethod
                                                         ? (SpatialCorrectionMethod) value
                                                         : SpatialCorrectionMethod.fromName(value.toString()));
                    break;
                case ModisSnowFillConstants.ALTITUDE_THRESHOLD_PARAM:
                    p.setAltitudeThreshold(toNumber(key, value).doubleValue());
                    break;
                case ModisSnowFillConstants.SNOW_VALUE_PARAM:
                    p.setSnowValue(toNumber(key, value).floatValue());
                    break;
                case ModisSnowFillConstants.NO_SNOW_VALUE_PARAM:
                    p.setNoSnowValue(toNumber(key, value).floatValue());
                    break;
                case ModisSnowFillConstants.SNOW_THRESHOLD_PARAM:
                    p.setSnowThreshold(toNumber(key, value).floatValue());
                    break;
                case ModisSnowFillConstants.MIN_SNOW_SAMPLE_COUNT_PARAM:
                    p.setMinSnowSampleCount(toNumber(key, value).intValue());
                    break;
                case ModisSnowFillConstants.MAX_HIGH_ELEVATION_GAP_RATIO_PARAM:
                    p.setMaxHighElevationGapRatio(toNumber(key, value).doubleValue());
                    break;
                case ModisSnowFillConstants.NUM_WORKERS_PARAM:
                    p.setNumWorkers(toNumber(key, value).intValue());
                    break;
                case ModisSnowFillConstants.CLASS_TABLE_PARAM:
                    if (!(value instanceof QualityClassTable)) {
                        throw new GapFillException("Parameter '" + key + "' must be a quality class table");
                    }
                    p.setClassTable((QualityClassTable) value);
                    break;
                case ModisSnowFillConstants.CLASS_TABLE_FILE_PARAM:
                    p.setClassTable(QualityClassTable.read(value instanceof File ? (File) value
                                                                   : new File(value.toString())));
                    break;
                default:
                    throw new GapFillException("Unknown parameter '" + key + "'");
            }
        }
        return p;
    }

    public static ModisGapFillParameters read(File file) {
        try (Reader r = new FileReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (FileNotFoundException e) {
            throw new GapFillException("cannot find parameter file " + file, e);
        } catch (GapFillException e) {
            throw e;
        } catch (Exception e) {
            throw new GapFillException("error reading parameter file " + file, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static ModisGapFillParameters read(Reader reader) {
        final Object parsed = JSONValue.parse(reader);
        if (!(parsed instanceof JSONObject)) {
            throw new GapFillException("parameters are not a JSON object");
        }
        return fromMap(new HashMap<String, Object>((JSONObject) parsed));
    }

    /**
     * Checks all parameters against their valid intervals.
     *
     * @throws GapFillException if a parameter is invalid
     */
    public void validate() {
        if (interpolationMethod == null) {
            throw new GapFillException("Parameter '" + ModisSnowFillConstants.INTERPOLATION_METHOD_PARAM +
                                               "' must be set");
        }
        if (spatialCorrectionMethod == null) {
            throw new GapFillException("Parameter '" + ModisSnowFillConstants.SPATIAL_CORRECTION_METHOD_PARAM +
                                               "' must be set");
        }
        check(ModisSnowFillConstants.ALTITUDE_THRESHOLD_PARAM, altitudeThreshold, ALTITUDE_RANGE);
        check(ModisSnowFillConstants.SNOW_VALUE_PARAM, snowValue, SNOW_COVER_RANGE);
        check(ModisSnowFillConstants.NO_SNOW_VALUE_PARAM, noSnowValue, SNOW_COVER_RANGE);
        if (!(snowValue > noSnowValue)) {
            // corrected pixels are told apart by their value
            throw new GapFillException("Parameter '" + ModisSnowFillConstants.SNOW_VALUE_PARAM + "' = " + snowValue +
                                               " must be greater than '" +
                                               ModisSnowFillConstants.NO_SNOW_VALUE_PARAM + "' = " + noSnowValue);
        }
        check(ModisSnowFillConstants.SNOW_THRESHOLD_PARAM, snowThreshold, SNOW_COVER_RANGE);
        check(ModisSnowFillConstants.MIN_SNOW_SAMPLE_COUNT_PARAM, minSnowSampleCount, COUNT_RANGE);
        check(ModisSnowFillConstants.MAX_HIGH_ELEVATION_GAP_RATIO_PARAM, maxHighElevationGapRatio, RATIO_RANGE);
        check(ModisSnowFillConstants.NUM_WORKERS_PARAM, numWorkers, COUNT_RANGE);
    }

    public SpatialCorrection createSpatialCorrection() {
        switch (spatialCorrectionMethod) {
            case ELEVATION_MEAN:
                return new ElevationMeanCorrection(snowValue, noSnowValue, minSnowSampleCount,
                                                   maxHighElevationGapRatio, altitudeThreshold);
            case NEIGHBOR_BASED:
                return new NeighborBasedCorrection(altitudeThreshold, snowThreshold, snowValue);
            default:
                return new NoSpatialCorrection();
        }
    }

    private static <T extends Comparable<T>> void check(String name, T value, Range<T> range) {
        // NaN is never contained
        if (value instanceof Double && ((Double) value).isNaN() ||
                value instanceof Float && ((Float) value).isNaN() || !range.contains(value)) {
            throw new GapFillException(String.format(ModisSnowFillConstants.INVALID_PARAMETER_ERROR_MESSAGE,
                                                     name, value, range));
        }
    }

    private static Number toNumber(String key, Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new GapFillException("Parameter '" + key + "' = '" + value + "' is not a number", e);
        }
    }

    public InterpolationMethod getInterpolationMethod() {
        return interpolationMethod;
    }

    public void setInterpolationMethod(InterpolationMethod interpolationMethod) {
        this.interpolationMethod = interpolationMethod;
    }

    public SpatialCorrectionMethod getSpatialCorrectionMethod() {
        return spatialCorrectionMethod;
    }

    public void setSpatialCorrectionMethod(SpatialCorrectionMethod spatialCorrectionMethod) {
        this.spatialCorrectionMethod = spatialCorrectionMethod;
    }

    public double getAltitudeThreshold() {
        return altitudeThreshold;
    }

    public void setAltitudeThreshold(double altitudeThreshold) {
        this.altitudeThreshold = altitudeThreshold;
    }

    public float getSnowValue() {
        return snowValue;
    }

    public void setSnowValue(float snowValue) {
        this.snowValue = snowValue;
    }

    public float getNoSnowValue() {
        return noSnowValue;
    }

    public void setNoSnowValue(float noSnowValue) {
        this.noSnowValue = noSnowValue;
    }

    public float getSnowThreshold() {
        return snowThreshold;
    }

    public void setSnowThreshold(float snowThreshold) {
        this.snowThreshold = snowThreshold;
    }

    public int getMinSnowSampleCount() {
        return minSnowSampleCount;
    }

    public void setMinSnowSampleCount(int minSnowSampleCount) {
        this.minSnowSampleCount = minSnowSampleCount;
    }

    public double getMaxHighElevationGapRatio() {
        return maxHighElevationGapRatio;
    }

    public void setMaxHighElevationGapRatio(double maxHighElevationGapRatio) {
        this.maxHighElevationGapRatio = maxHighElevationGapRatio;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public void setNumWorkers(int numWorkers) {
        this.numWorkers = numWorkers;
    }

    /**
     * @return the class table, or null to use the default table
     */
    public QualityClassTable getClassTable() {
        return classTable;
    }

    public void setClassTable(QualityClassTable classTable) {
        this.classTable = classTable;
    }
}
