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
package org.esa.snowfill.core.stats;

/**
 * Mutable accumulator of pixel counters, kept in total and per day. Each worker fills its own
 * instance; instances are combined with {@link #add(PixelCounts)}, which is associative and commutative.
 */
public class PixelCounts {

    private static final int NUM_COUNTERS = PixelCounter.values().length;

    private final int numDays;
    private final long[][] dailyCounts;

    public PixelCounts(int numDays) {
        this.numDays = numDays;
        this.dailyCounts = new long[numDays][NUM_COUNTERS];
    }

    public int getNumDays() {
        return numDays;
    }

    public void increment(PixelCounter counter, int day) {
        dailyCounts[day][counter.ordinal()]++;
    }

    public void add(PixelCounter counter, int day, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counters are monotone, cannot add " + amount);
        }
        dailyCounts[day][counter.ordinal()] += amount;
    }

    public void add(PixelCounts other) {
        if (other.numDays != numDays) {
            throw new IllegalArgumentException("Cannot merge counts of " + other.numDays + " days into " +
                                                       numDays + " days");
        }
        for (int t = 0; t < numDays; t++) {
            for (int i = 0; i < NUM_COUNTERS; i++) {
                dailyCounts[t][i] += other.dailyCounts[t][i];
            }
        }
    }

    public long get(PixelCounter counter) {
        long sum = 0;
        for (int t = 0; t < numDays; t++) {
            sum += dailyCounts[t][counter.ordinal()];
        }
        return sum;
    }

    public long get(PixelCounter counter, int day) {
        return dailyCounts[day][counter.ordinal()];
    }

    public PixelCountsSnapshot snapshot() {
        final long[][] copy = new long[numDays][];
        for (int t = 0; t < numDays; t++) {
            copy[t] = dailyCounts[t].clone();
        }
        return new PixelCountsSnapshot(copy);
    }
}
