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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import ml.shifu.scorebin.container.obj.PsiAggregation;

/**
 * Stability and separation metrics of one bin set, always recomputed from a fresh {@link CohortTable}.
 */
public final class StabilityMetrics {

    /**
     * If metrics across cohorts were computed. When false PSI values and separability are 0.
     */
    private final boolean stabilityChecked;

    private final String referenceCohort;

    private final List<String> cohortIds;

    /**
     * PSI of each non-reference cohort against the reference cohort, in cohort order.
     */
    private final Map<String, Double> psiByCohort;

    private final double psiMean;

    private final double psiMax;

    private final double ks;

    private final double separability;

    /**
     * Event rate of each bin in each cohort, NaN for empty cells.
     */
    private final List<List<Double>> eventRateSeries;

    /**
     * Standard deviation of each bin's event rate series.
     */
    private final List<Double> eventRateStd;

    /**
     * Max minus min of each bin's event rate series.
     */
    private final List<Double> eventRateRange;

    private final List<GuardSubstitution> substitutions;

    private final List<CohortCell> undefinedCells;

    StabilityMetrics(boolean stabilityChecked, String referenceCohort, List<String> cohortIds,
            Map<String, Double> psiByCohort, double psiMean, double psiMax, double ks, double separability,
            List<List<Double>> eventRateSeries, List<Double> eventRateStd, List<Double> eventRateRange,
            List<GuardSubstitution> substitutions, List<CohortCell> undefinedCells) {
        this.stabilityChecked = stabilityChecked;
        this.referenceCohort = referenceCohort;
        this.cohortIds = Collections.unmodifiableList(cohortIds);
        this.psiByCohort = Collections.unmodifiableMap(psiByCohort);
        this.psiMean = psiMean;
        this.psiMax = psiMax;
        this.ks = ks;
        this.separability = separability;
        this.eventRateSeries = Collections.unmodifiableList(eventRateSeries);
        this.eventRateStd = Collections.unmodifiableList(eventRateStd);
        this.eventRateRange = Collections.unmodifiableList(eventRateRange);
        this.substitutions = Collections.unmodifiableList(substitutions);
        this.undefinedCells = Collections.unmodifiableList(undefinedCells);
    }

    public boolean isStabilityChecked() {
        return stabilityChecked;
    }

    public String getReferenceCohort() {
        return referenceCohort;
    }

    public List<String> getCohortIds() {
        return cohortIds;
    }

    public Map<String, Double> getPsiByCohort() {
        return psiByCohort;
    }

    public double getPsiMean() {
        return psiMean;
    }

    public double getPsiMax() {
        return psiMax;
    }

    public double getPsi(PsiAggregation aggregation) {
        return aggregation == PsiAggregation.MAX ? psiMax : psiMean;
    }

    public double getKs() {
        return ks;
    }

    public double getSeparability() {
        return separability;
    }

    public List<List<Double>> getEventRateSeries() {
        return eventRateSeries;
    }

    public List<Double> getEventRateStd() {
        return eventRateStd;
    }

    public List<Double> getEventRateRange() {
        return eventRateRange;
    }

    public List<GuardSubstitution> getSubstitutions() {
        return substitutions;
    }

    public List<CohortCell> getUndefinedCells() {
        return undefinedCells;
    }

    @Override
    public String toString() {
        return "StabilityMetrics [psiMean=" + psiMean + ", psiMax=" + psiMax + ", ks=" + ks + ", separability="
                + separability + ", reference=" + referenceCohort + ", substitutions=" + substitutions.size()
                + ", undefinedCells=" + undefinedCells.size() + "]";
    }
}
