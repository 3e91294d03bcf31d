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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.core.ColumnStatsCalculator;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.exception.EmptyCohortException;
import ml.shifu.scorebin.exception.InsufficientDataException;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes PSI, KS and temporal separability of a bin set from its {@link CohortTable}.
 *
 * <p>
 * PSI of cohort c is {@code sum((p_i - q_i) * ln(p_i / q_i))} over bins, p being population shares of c and q those of
 * the reference cohort. Shares under epsilon are floored to epsilon and each floor is recorded as a
 * {@link GuardSubstitution}.
 *
 * <p>
 * Temporal separability is the mean over bin pairs of the mean absolute event rate difference over cohorts. The
 * distance is symmetric and cohort by cohort, so the score does not depend on cohort order.
 */
public final class StabilityScorer {

    private static final Logger LOG = LoggerFactory.getLogger(StabilityScorer.class);

    private StabilityScorer() {
    }

    /**
     * @param table
     *            aggregated cells of the bin set
     * @param config
     *            reference cohort, epsilon and separability penalties
     * @return stability metrics
     * @throws InsufficientDataException
     *             if any bin has zero population, or there is no event or no non-event
     * @throws EmptyCohortException
     *             if stability is requested with less than two cohorts
     */
    public static StabilityMetrics score(CohortTable table, BinningConfig config) {
        int binCount = table.getBinCount();
        int cohortCount = table.getCohortCount();

        for(int bin = 0; bin < binCount; bin++) {
            if(table.getBinCount(bin) == 0) {
                throw new InsufficientDataException("Bin " + bin + " has zero population, event rate is undefined.");
            }
        }

        double ks = ColumnStatsCalculator.calculateKs(table.getBinNonEvents(), table.getBinEvents());

        List<List<Double>> series = new ArrayList<List<Double>>(binCount);
        List<Double> stds = new ArrayList<Double>(binCount);
        List<Double> ranges = new ArrayList<Double>(binCount);
        List<CohortCell> undefinedCells = new ArrayList<CohortCell>();
        for(int bin = 0; bin < binCount; bin++) {
            List<Double> rates = new ArrayList<Double>(cohortCount);
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for(int cohort = 0; cohort < cohortCount; cohort++) {
                double rate = table.getEventRate(bin, cohort);
                rates.add(rate);
                if(Double.isNaN(rate)) {
                    undefinedCells.add(table.getCell(bin, cohort));
                } else {
                    stats.addValue(rate);
                }
            }
            series.add(rates);
            stds.add(stats.getStandardDeviation());
            ranges.add(stats.getN() == 0 ? Double.NaN : stats.getMax() - stats.getMin());
        }

        List<GuardSubstitution> substitutions = new ArrayList<GuardSubstitution>();
        Map<String, Double> psiByCohort = new LinkedHashMap<String, Double>();

        if(!config.isCheckStability()) {
            return new StabilityMetrics(false, null, table.getCohortIds(), psiByCohort, 0d, 0d, ks, 0d, series,
                    stds, ranges, substitutions, undefinedCells);
        }

        if(cohortCount < 2) {
            throw new EmptyCohortException("Stability checking needs at least 2 distinct cohorts, but only "
                    + table.getCohortIds() + " is found.");
        }

        int reference = resolveReference(table, config.getReferenceCohort());
        String referenceId = table.getCohortIds().get(reference);

        SummaryStatistics psiStats = new SummaryStatistics();
        for(int cohort = 0; cohort < cohortCount; cohort++) {
            if(cohort == reference) {
                continue;
            }
            double psi = psi(table, cohort, reference, config.getEpsilon(), substitutions);
            psiByCohort.put(table.getCohortIds().get(cohort), psi);
            psiStats.addValue(psi);
        }

        double separability = separability(series, binCount, cohortCount);
        if(config.isPenalizeInversions()) {
            separability -= config.getPenalty() * countInversions(series);
        }
        if(config.isPenalizeLowFrequency()) {
            separability -= config.getPenalty() * countLowFrequencyBins(table, config.getLowFrequencyThreshold());
        }

        if(!substitutions.isEmpty()) {
            LOG.debug("{} shares floored to epsilon {} in PSI: {}", substitutions.size(), config.getEpsilon(),
                    substitutions);
        }

        return new StabilityMetrics(true, referenceId, table.getCohortIds(), psiByCohort, psiStats.getMean(),
                psiStats.getMax(), ks, separability, series, stds, ranges, substitutions, undefinedCells);
    }

    private static int resolveReference(CohortTable table, String referenceCohort) {
        if(referenceCohort == null) {
            // earliest
            return 0;
        }
        int reference = table.cohortIndexOf(referenceCohort);
        if(reference < 0) {
            throw new BinningException(BinningErrorCode.ERROR_REFERENCE_COHORT_NOT_FOUND, "Reference cohort "
                    + referenceCohort + " is not in " + table.getCohortIds());
        }
        return reference;
    }

    private static double psi(CohortTable table, int cohort, int reference, double epsilon,
            List<GuardSubstitution> substitutions) {
        String cohortId = table.getCohortIds().get(cohort);
        double cohortTotal = table.getCohortTotal(cohort);
        double referenceTotal = table.getCohortTotal(reference);
        double psi = 0d;
        for(int bin = 0; bin < table.getBinCount(); bin++) {
            double p = table.getCount(bin, cohort) / cohortTotal;
            double q = table.getCount(bin, reference) / referenceTotal;
            if(p < epsilon) {
                substitutions.add(new GuardSubstitution(GuardSubstitution.PSI, bin, cohortId, "cohort", p, epsilon));
                p = epsilon;
            }
            if(q < epsilon) {
                substitutions.add(new GuardSubstitution(GuardSubstitution.PSI, bin, cohortId, "reference", q,
                        epsilon));
                q = epsilon;
            }
            psi += (p - q) * Math.log(p / q);
        }
        return psi;
    }

    static double separability(List<List<Double>> series, int binCount, int cohortCount) {
        double pairSum = 0d;
        int pairCount = 0;
        for(int i = 0; i < binCount; i++) {
            for(int j = i + 1; j < binCount; j++) {
                double distance = 0d;
                int defined = 0;
                for(int cohort = 0; cohort < cohortCount; cohort++) {
                    double ri = series.get(i).get(cohort);
                    double rj = series.get(j).get(cohort);
                    if(!Double.isNaN(ri) && !Double.isNaN(rj)) {
                        distance += Math.abs(ri - rj);
                        defined++;
                    }
                }
                if(defined > 0) {
                    pairSum += distance / defined;
                    pairCount++;
                }
            }
        }
        return pairCount == 0 ? 0d : pairSum / pairCount;
    }

    /**
     * A bin is inverted when its event rate goes both up and down across cohorts.
     */
    static int countInversions(List<List<Double>> series) {
        int inversions = 0;
        for(List<Double> rates: series) {
            boolean up = false, down = false;
            double previous = Double.NaN;
            for(Double rate: rates) {
                if(rate.isNaN()) {
                    continue;
                }
                if(!Double.isNaN(previous)) {
                    up |= rate > previous;
                    down |= rate < previous;
                }
                previous = rate;
            }
            if(up && down) {
                inversions++;
            }
        }
        return inversions;
    }

    /**
     * A bin is low frequency when its smallest non-empty cohort cell holds less than threshold observations.
     */
    private static int countLowFrequencyBins(CohortTable table, int threshold) {
        int lowBins = 0;
        for(int bin = 0; bin < table.getBinCount(); bin++) {
            long min = Long.MAX_VALUE;
            for(int cohort = 0; cohort < table.getCohortCount(); cohort++) {
                // cohorts without the bin are not counted as low frequency
                if(table.getCount(bin, cohort) > 0L) {
                    min = Math.min(min, table.getCount(bin, cohort));
                }
            }
            if(min < threshold) {
                lowBins++;
            }
        }
        return lowBins;
    }
}
