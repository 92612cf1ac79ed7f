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

package org.esa.snowfill.core;

/**
 * Signals that a gap filling run cannot be carried out, e.g. because of inconsistent input grids
 * or an invalid configuration. Raised before any grid is processed.
 */
public class GapFillException extends RuntimeException {

    public GapFillException(String message) {
        super(message);
    }

    public GapFillException(String message, Throwable cause) {
        super(message, cause);
    }

    public GapFillException(Throwable cause) {
        super(cause);
    }
}
