/*
 * Copyright [2013-2016] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.scorebin.core.stability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat (bin, cohort) table of counts and events. Cell (b, c) lives at {@code b * cohortCount + c}; every pair is
 * present, including pairs without observation.
 *
 * <p>
 * Instances are produced by {@link CohortAggregator} and never updated, a changed bin set gets a new table.
 */
public final class CohortTable {

    private final int binCount;

    /**
     * Sorted cohort ids, index in this list is the cohort index.
     */
    private final List<String> cohortIds;

    private final long[] counts;

    private final long[] events;

    CohortTable(int binCount, List<String> cohortIds, long[] counts, long[] events) {
        assert counts.length == binCount * cohortIds.size() && events.length == counts.length;
        this.binCount = binCount;
        this.cohortIds = Collections.unmodifiableList(new ArrayList<String>(cohortIds));
        this.counts = counts;
        this.events = events;
    }

    private int offset(int bin, int cohort) {
        return bin * cohortIds.size() + cohort;
    }

    public int getBinCount() {
        return binCount;
    }

    public int getCohortCount() {
        return cohortIds.size();
    }

    public List<String> getCohortIds() {
        return cohortIds;
    }

    /**
     * @param cohortId
     *            the cohort id
     * @return cohort index, or -1 if the cohort is not observed
     */
    public int cohortIndexOf(String cohortId) {
        int index = Collections.binarySearch(cohortIds, cohortId);
        return index >= 0 ? index : -1;
    }

    public CohortCell getCell(int bin, int cohort) {
        int offset = offset(bin, cohort);
        return new CohortCell(bin, cohort, cohortIds.get(cohort), counts[offset], events[offset]);
    }

    /**
     * @return all cells, bin by bin and cohort by cohort inside each bin
     */
    public List<CohortCell> getCells() {
        List<CohortCell> cells = new ArrayList<CohortCell>(counts.length);
        for(int bin = 0; bin < binCount; bin++) {
            for(int cohort = 0; cohort < cohortIds.size(); cohort++) {
                cells.add(getCell(bin, cohort));
            }
        }
        return cells;
    }

    public long getCount(int bin, int cohort) {
        return counts[offset(bin, cohort)];
    }

    public long getEventCount(int bin, int cohort) {
        return events[offset(bin, cohort)];
    }

    /**
     * @return event rate of the cell, NaN if the cell is empty
     */
    public double getEventRate(int bin, int cohort) {
        long count = getCount(bin, cohort);
        return count == 0 ? Double.NaN : ((double) getEventCount(bin, cohort)) / count;
    }

    public long getBinCount(int bin) {
        long sum = 0L;
        for(int cohort = 0; cohort < cohortIds.size(); cohort++) {
            sum += getCount(bin, cohort);
        }
        return sum;
    }

    public long getBinEventCount(int bin) {
        long sum = 0L;
        for(int cohort = 0; cohort < cohortIds.size(); cohort++) {
            sum += getEventCount(bin, cohort);
        }
        return sum;
    }

    /**
     * @return event rate of the bin over all cohorts, NaN if the bin is empty
     */
    public double getBinEventRate(int bin) {
        long count = getBinCount(bin);
        return count == 0 ? Double.NaN : ((double) getBinEventCount(bin)) / count;
    }

    public long getCohortTotal(int cohort) {
        long sum = 0L;
        for(int bin = 0; bin < binCount; bin++) {
            sum += getCount(bin, cohort);
        }
        return sum;
    }

    public long getTotalCount() {
        long sum = 0L;
        for(long count: counts) {
            sum += count;
        }
        return sum;
    }

    public long getTotalEventCount() {
        long sum = 0L;
        for(long event: events) {
            sum += event;
        }
        return sum;
    }

    /**
     * @return population of each bin over all cohorts
     */
    public long[] getBinTotals() {
        long[] totals = new long[binCount];
        for(int bin = 0; bin < binCount; bin++) {
            totals[bin] = getBinCount(bin);
        }
        return totals;
    }

    public long[] getBinEvents() {
        long[] totals = new long[binCount];
        for(int bin = 0; bin < binCount; bin++) {
            totals[bin] = getBinEventCount(bin);
        }
        return totals;
    }

    public long[] getBinNonEvents() {
        long[] totals = new long[binCount];
        for(int bin = 0; bin < binCount; bin++) {
            totals[bin] = getBinCount(bin) - getBinEventCount(bin);
        }
        return totals;
    }

    public double[] getBinEventRates() {
        double[] rates = new double[binCount];
        for(int bin = 0; bin < binCount; bin++) {
            rates[bin] = getBinEventRate(bin);
        }
        return rates;
    }

    @Override
    public String toString() {
        return "CohortTable [bins=" + binCount + ", cohorts=" + cohortIds + ", total=" + getTotalCount() + "]";
    }
}
