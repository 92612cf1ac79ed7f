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
package org.esa.snowfill.core.quality;

import org.esa.snowfill.core.GapFillException;
import org.esa.snowfill.core.SnowFillConstants;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping of quality class codes to categories and verdicts.
 * <p>
 * The JSON form is
 * <pre>
 * { "classes": [ { "name": "snow", "verdict": "SNOW_VALID", "codes": [1] }, ... ] }
 * </pre>
 * Codes not listed in the table are {@link QualityVerdict#INVALID}.
 */
public class QualityClassTable {

    static final String CLASSES_KEY = "classes";
    static final String NAME_KEY = "name";
    static final String VERDICT_KEY = "verdict";
    static final String CODES_KEY = "codes";

    private final List<QualityClass> classes;
    private final Map<Integer, QualityClass> classByCode;

    public QualityClassTable(List<QualityClass> classes) {
        this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
        this.classByCode = new HashMap<>();
        for (QualityClass qualityClass : classes) {
            for (int code : qualityClass.getCodes()) {
                final QualityClass previous = classByCode.put(code, qualityClass);
                if (previous != null && previous != qualityClass) {
                    throw new GapFillException("Quality class code " + code + " is assigned to both '" +
                                                       previous.getName() + "' and '" + qualityClass.getName() + "'");
                }
            }
        }
    }

    /**
     * Provides the MOD10A1 class table shipped with SnowFill.
     *
     * @return the default table
     */
    public static QualityClassTable createDefault() {
        final InputStream stream =
                QualityClassTable.class.getResourceAsStream(SnowFillConstants.DEFAULT_CLASS_TABLE_RESOURCE);
        if (stream == null) {
            throw new GapFillException("cannot find default class table " +
                                               SnowFillConstants.DEFAULT_CLASS_TABLE_RESOURCE);
        }
        try (Reader r = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (GapFillException e) {
            throw e;
        } catch (Exception e) {
            throw new GapFillException("error reading default class table", e);
        }
    }

    public static QualityClassTable read(File file) {
        try (Reader r = new FileReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (FileNotFoundException e) {
            throw new GapFillException("cannot find class table file " + file, e);
        } catch (GapFillException e) {
            throw e;
        } catch (Exception e) {
            throw new GapFillException("error reading class table file " + file, e);
        }
    }

    public static QualityClassTable read(Reader reader) {
        final Object parsed = JSONValue.parse(reader);
        if (!(parsed instanceof JSONObject)) {
            throw new GapFillException("class table is not a JSON object");
        }
        return fromJson((JSONObject) parsed);
    }

    static QualityClassTable fromJson(JSONObject json) {
        final Object classesObject = json.get(CLASSES_KEY);
        if (!(classesObject instanceof JSONArray)) {
            throw new GapFillException("class table has no '" + CLASSES_KEY + "' array");
        }
        final List<QualityClass> classes = new ArrayList<>();
        for (Object entry : (JSONArray) classesObject) {
            if (!(entry instanceof JSONObject)) {
                throw new GapFillException("malformed class table entry: " + entry);
            }
            final JSONObject c = (JSONObject) entry;
            final Object name = c.get(NAME_KEY);
            final Object verdict = c.get(VERDICT_KEY);
            final Object codes = c.get(CODES_KEY);
            if (!(name instanceof String) || !(verdict instanceof String) || !(codes instanceof JSONArray)) {
                throw new GapFillException("class table entry needs name, verdict and codes: " + c);
            }
            final QualityVerdict qualityVerdict;
            try {
                qualityVerdict = QualityVerdict.valueOf((String) verdict);
            } catch (IllegalArgumentException e) {
                throw new GapFillException("unknown verdict '" + verdict + "' in class table", e);
            }
            final JSONArray codeArray = (JSONArray) codes;
            final int[] codeValues = new int[codeArray.size()];
            for (int i = 0; i < codeValues.length; i++) {
                final Object code = codeArray.get(i);
                if (!(code instanceof Number)) {
                    throw new GapFillException("class code '" + code + "' is not a number");
                }
                codeValues[i] = ((Number) code).intValue();
            }
            classes.add(new QualityClass((String) name, qualityVerdict, codeValues));
        }
        return new QualityClassTable(classes);
    }

    public List<QualityClass> getClasses() {
        return classes;
    }

    /**
     * @param code - a quality class code
     * @return the class of the code, or null if the code is unknown
     */
    public QualityClass getQualityClass(int code) {
        return classByCode.get(code);
    }

    public QualityVerdict getVerdict(int code) {
        final QualityClass qualityClass = classByCode.get(code);
        return qualityClass != null ? qualityClass.getVerdict() : QualityVerdict.INVALID;
    }
}
