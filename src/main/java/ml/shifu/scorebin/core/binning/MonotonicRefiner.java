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
package ml.shifu.scorebin.core.binning;

import java.util.ArrayList;
import java.util.List;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.MonotonicDirection;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.MergeStep.Reason;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.stability.CohortAggregator;
import ml.shifu.scorebin.core.stability.CohortTable;
import ml.shifu.scorebin.exception.UnsatisfiableConstraintException;
import ml.shifu.scorebin.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges adjacent bins until event rates are monotone in the configured direction, every adjacent event rate gap is
 * at least {@code minEventRateDiff} and every bin holds at least {@code minBinSize} of the population.
 *
 * <p>
 * Each iteration re-aggregates the current bins and merges exactly one pair, checked in this order:
 * <ol>
 * <li>an empty bin, with its right neighbour (left one for the last bin);</li>
 * <li>the leftmost pair breaking the direction;</li>
 * <li>the leftmost pair closer than {@code minEventRateDiff};</li>
 * <li>the leftmost bin under {@code minBinSize}, with the neighbour of closer event rate.</li>
 * </ol>
 * Bin count goes down by one each iteration, so the loop ends with at most {@code n - 1} merges. The merge is greedy
 * and keeps determinism, not max information value.
 */
public final class MonotonicRefiner {

    private static final Logger LOG = LoggerFactory.getLogger(MonotonicRefiner.class);

    private MonotonicRefiner() {
    }

    /**
     * @param initial
     *            bins from the initial splitter
     * @param observations
     *            observations the bins are refined on
     * @param config
     *            direction, min event rate difference, min bin size and min bin number
     * @return final bins, their aggregation and the merge log
     * @throws UnsatisfiableConstraintException
     *             if hard constraints contradict each other
     */
    public static RefinementResult refine(BinSet initial, List<Observation> observations, BinningConfig config) {
        checkConstraints(initial, config);

        BinSet current = initial;
        CohortTable table = CohortAggregator.aggregate(current, observations);
        MonotonicDirection direction = resolveDirection(config.getMonotonic(), table);

        List<MergeStep> steps = new ArrayList<MergeStep>();
        int iteration = 0;
        while(current.size() > 1) {
            MergeCandidate candidate = findMerge(table, direction, config);
            if(candidate == null) {
                break;
            }

            iteration++;
            current = current.mergeAt(candidate.leftIndex);
            MergeStep step = new MergeStep(iteration, candidate.leftIndex, candidate.reason,
                    table.getBinEventRate(candidate.leftIndex), table.getBinEventRate(candidate.leftIndex + 1),
                    current.size());
            steps.add(step);
            LOG.debug("Refinement {}", step);

            table = CohortAggregator.aggregate(current, observations);
        }

        if(current.size() < config.getMinBins()) {
            throw new UnsatisfiableConstraintException("Refinement ends with " + current.size()
                    + " bins, less than minBins " + config.getMinBins() + " under " + direction
                    + " direction and minEventRateDiff " + config.getMinEventRateDiff() + ".");
        }

        if(current.size() == 1) {
            LOG.warn("All bins are merged into one bin after {} merges, the feature has no usable signal.",
                    steps.size());
        } else {
            LOG.debug("Refinement finished with {} bins after {} merges, direction {}.", current.size(),
                    steps.size(), direction);
        }
        return new RefinementResult(current, table, direction, steps);
    }

    /**
     * @return true if no merge is needed on this bin set
     */
    public static boolean isTerminal(BinSet binSet, List<Observation> observations, BinningConfig config) {
        CohortTable table = CohortAggregator.aggregate(binSet, observations);
        return binSet.size() == 1
                || findMerge(table, resolveDirection(config.getMonotonic(), table), config) == null;
    }

    private static void checkConstraints(BinSet initial, BinningConfig config) {
        if(config.getMinBinSize() < 0d || config.getMinBinSize() > 1d) {
            throw new UnsatisfiableConstraintException("minBinSize " + config.getMinBinSize()
                    + " is not a population fraction in [0, 1].");
        }
        if(config.getMinEventRateDiff() < 0d) {
            throw new UnsatisfiableConstraintException("minEventRateDiff " + config.getMinEventRateDiff()
                    + " must not be negative.");
        }
        if(config.getMinBins() < 1) {
            throw new UnsatisfiableConstraintException("minBins " + config.getMinBins() + " should be at least 1.");
        }
        if(config.getMinBins() > config.getMaxBins()) {
            throw new UnsatisfiableConstraintException("minBins " + config.getMinBins() + " is greater than maxBins "
                    + config.getMaxBins() + ".");
        }
        if(config.getMinBins() > initial.size()) {
            throw new UnsatisfiableConstraintException("minBins " + config.getMinBins()
                    + " is greater than the initial bin number " + initial.size() + ".");
        }
    }

    /**
     * Resolve {@link MonotonicDirection#AUTO} from the sign of the count weighted covariance between bin ordinal and
     * bin event rate. Non-negative covariance means increasing.
     */
    static MonotonicDirection resolveDirection(MonotonicDirection configured, CohortTable table) {
        if(configured != MonotonicDirection.AUTO) {
            return configured;
        }

        long[] totals = table.getBinTotals();
        double[] rates = table.getBinEventRates();
        double total = table.getTotalCount();
        double meanRate = table.getTotalEventCount() / total;
        double meanOrdinal = 0d;
        for(int i = 0; i < totals.length; i++) {
            meanOrdinal += i * totals[i] / total;
        }

        double covariance = 0d;
        for(int i = 0; i < totals.length; i++) {
            if(totals[i] > 0) {
                covariance += totals[i] * (i - meanOrdinal) * (rates[i] - meanRate);
            }
        }
        MonotonicDirection resolved = covariance >= 0d ? MonotonicDirection.INCREASING : MonotonicDirection.DECREASING;
        LOG.debug("Monotonic direction auto detected as {} (covariance {}).", resolved, covariance);
        return resolved;
    }

    private static MergeCandidate findMerge(CohortTable table, MonotonicDirection direction, BinningConfig config) {
        int n = table.getBinCount();
        long[] totals = table.getBinTotals();
        double[] rates = table.getBinEventRates();

        for(int i = 0; i < n; i++) {
            if(totals[i] == 0L) {
                return new MergeCandidate(i < n - 1 ? i : i - 1, Reason.EMPTY_BIN);
            }
        }

        if(direction != MonotonicDirection.NONE) {
            for(int i = 0; i < n - 1; i++) {
                if(direction.isViolatedBy(rates[i], rates[i + 1])) {
                    return new MergeCandidate(i, Reason.MONOTONICITY);
                }
            }
        }

        for(int i = 0; i < n - 1; i++) {
            if(Math.abs(rates[i + 1] - rates[i]) < config.getMinEventRateDiff() - Constants.RATE_DIFF_TOLERANCE) {
                return new MergeCandidate(i, Reason.MIN_EVENT_RATE_DIFF);
            }
        }

        double minCount = config.getMinBinSize() * table.getTotalCount();
        for(int i = 0; i < n; i++) {
            if(totals[i] < minCount) {
                return new MergeCandidate(closerNeighbour(rates, i), Reason.MIN_BIN_SIZE);
            }
        }

        return null;
    }

    /**
     * @return left index of the pair made of bin i and its neighbour of closer event rate, left one on tie
     */
    private static int closerNeighbour(double[] rates, int i) {
        if(i == 0) {
            return 0;
        }
        if(i == rates.length - 1) {
            return i - 1;
        }
        double leftGap = Math.abs(rates[i] - rates[i - 1]);
        double rightGap = Math.abs(rates[i + 1] - rates[i]);
        return leftGap <= rightGap ? i - 1 : i;
    }

    private static class MergeCandidate {
        private final int leftIndex;
        private final Reason reason;

        private MergeCandidate(int leftIndex, Reason reason) {
            this.leftIndex = leftIndex;
            this.reason = reason;
        }
    }
}
