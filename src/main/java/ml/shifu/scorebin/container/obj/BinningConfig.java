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
package ml.shifu.scorebin.container.obj;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.util.Constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@link BinningConfig} is the immutable configuration passed into every refinement and scoring call, it can be read
 * from BinningConfig.json.
 *
 * <p>
 * Only malformed values (negative epsilon, negative counts) are rejected here. Constraint values that contradict each
 * other, like a min bin size over 1.0, are kept as they are and reported by the refiner as
 * {@link ml.shifu.scorebin.exception.UnsatisfiableConstraintException}, so a search trial can record them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BinningConfig {

    public static final BinningConfig DEFAULT = builder().build();

    /**
     * Direction of event rates, AUTO to detect it from the initial bins.
     */
    private final MonotonicDirection monotonic;

    /**
     * Min absolute event rate difference between two adjacent bins.
     */
    private final double minEventRateDiff;

    /**
     * Min population fraction of each bin.
     */
    private final double minBinSize;

    /**
     * Max num bin generated by the initial splitter.
     */
    private final int maxBins;

    /**
     * Min num bin after refinement.
     */
    private final int minBins;

    private final ObjectiveWeights weights;

    /**
     * Reference cohort of PSI, earliest cohort if null.
     */
    private final String referenceCohort;

    /**
     * If stability metrics across cohorts are required, which needs at least two cohorts.
     */
    private final boolean checkStability;

    /**
     * Floor of population and event shares before taking logarithm in PSI, IV and WoE.
     */
    private final double epsilon;

    private final PsiAggregation psiAggregation;

    private final boolean penalizeInversions;

    private final boolean penalizeLowFrequency;

    private final int lowFrequencyThreshold;

    /**
     * Separability penalty per inverted or low frequency bin.
     */
    private final double penalty;

    /**
     * Categories with population share under this value are grouped before categorical splitting.
     */
    private final double rareThreshold;

    @JsonCreator
    public BinningConfig(@JsonProperty("monotonic") MonotonicDirection monotonic,
            @JsonProperty("minEventRateDiff") Double minEventRateDiff, @JsonProperty("minBinSize") Double minBinSize,
            @JsonProperty("maxBins") Integer maxBins, @JsonProperty("minBins") Integer minBins,
            @JsonProperty("weights") ObjectiveWeights weights,
            @JsonProperty("referenceCohort") String referenceCohort,
            @JsonProperty("checkStability") Boolean checkStability, @JsonProperty("epsilon") Double epsilon,
            @JsonProperty("psiAggregation") PsiAggregation psiAggregation,
            @JsonProperty("penalizeInversions") Boolean penalizeInversions,
            @JsonProperty("penalizeLowFrequency") Boolean penalizeLowFrequency,
            @JsonProperty("lowFrequencyThreshold") Integer lowFrequencyThreshold,
            @JsonProperty("penalty") Double penalty, @JsonProperty("rareThreshold") Double rareThreshold) {
        this.monotonic = monotonic == null ? MonotonicDirection.AUTO : monotonic;
        this.minEventRateDiff = minEventRateDiff == null ? 0.02d : minEventRateDiff;
        this.minBinSize = minBinSize == null ? 0.05d : minBinSize;
        this.maxBins = maxBins == null ? 6 : maxBins;
        this.minBins = minBins == null ? 1 : minBins;
        this.weights = weights == null ? ObjectiveWeights.DEFAULT : weights;
        this.referenceCohort = referenceCohort;
        this.checkStability = checkStability == null ? true : checkStability;
        this.epsilon = epsilon == null ? Constants.DEFAULT_EPSILON : epsilon;
        this.psiAggregation = psiAggregation == null ? PsiAggregation.MEAN : psiAggregation;
        this.penalizeInversions = penalizeInversions == null ? false : penalizeInversions;
        this.penalizeLowFrequency = penalizeLowFrequency == null ? false : penalizeLowFrequency;
        this.lowFrequencyThreshold = lowFrequencyThreshold == null ? 30 : lowFrequencyThreshold;
        this.penalty = penalty == null ? 0.1d : penalty;
        this.rareThreshold = rareThreshold == null ? 0.01d : rareThreshold;

        if(!(this.epsilon > 0d && this.epsilon < 1d)) {
            throw invalid("epsilon should be in (0, 1), but got " + this.epsilon);
        }
        if(this.maxBins < 1) {
            throw invalid("maxBins should be positive, but got " + this.maxBins);
        }
        if(this.lowFrequencyThreshold < 0 || this.penalty < 0d || this.rareThreshold < 0d) {
            throw invalid("lowFrequencyThreshold, penalty and rareThreshold must not be negative.");
        }
    }

    private static BinningException invalid(String msg) {
        return new BinningException(BinningErrorCode.ERROR_INVALID_BINNING_CONFIG, msg);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().monotonic(monotonic).minEventRateDiff(minEventRateDiff).minBinSize(minBinSize)
                .maxBins(maxBins).minBins(minBins).weights(weights).referenceCohort(referenceCohort)
                .checkStability(checkStability).epsilon(epsilon).psiAggregation(psiAggregation)
                .penalizeInversions(penalizeInversions).penalizeLowFrequency(penalizeLowFrequency)
                .lowFrequencyThreshold(lowFrequencyThreshold).penalty(penalty).rareThreshold(rareThreshold);
    }

    public MonotonicDirection getMonotonic() {
        return monotonic;
    }

    public double getMinEventRateDiff() {
        return minEventRateDiff;
    }

    public double getMinBinSize() {
        return minBinSize;
    }

    public int getMaxBins() {
        return maxBins;
    }

    public int getMinBins() {
        return minBins;
    }

    public ObjectiveWeights getWeights() {
        return weights;
    }

    public String getReferenceCohort() {
        return referenceCohort;
    }

    public boolean isCheckStability() {
        return checkStability;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public PsiAggregation getPsiAggregation() {
        return psiAggregation;
    }

    public boolean isPenalizeInversions() {
        return penalizeInversions;
    }

    public boolean isPenalizeLowFrequency() {
        return penalizeLowFrequency;
    }

    public int getLowFrequencyThreshold() {
        return lowFrequencyThreshold;
    }

    public double getPenalty() {
        return penalty;
    }

    public double getRareThreshold() {
        return rareThreshold;
    }

    @Override
    public String toString() {
        return "BinningConfig [monotonic=" + monotonic + ", minEventRateDiff=" + minEventRateDiff + ", minBinSize="
                + minBinSize + ", maxBins=" + maxBins + ", minBins=" + minBins + ", weights=" + weights
                + ", referenceCohort=" + referenceCohort + ", checkStability=" + checkStability + ", epsilon="
                + epsilon + ", psiAggregation=" + psiAggregation + "]";
    }

    /**
     * Builder of {@link BinningConfig}, unset values take the json defaults.
     */
    public static class Builder {
        private MonotonicDirection monotonic;
        private Double minEventRateDiff;
        private Double minBinSize;
        private Integer maxBins;
        private Integer minBins;
        private ObjectiveWeights weights;
        private String referenceCohort;
        private Boolean checkStability;
        private Double epsilon;
        private PsiAggregation psiAggregation;
        private Boolean penalizeInversions;
        private Boolean penalizeLowFrequency;
        private Integer lowFrequencyThreshold;
        private Double penalty;
        private Double rareThreshold;

        public Builder monotonic(MonotonicDirection monotonic) {
            this.monotonic = monotonic;
            return this;
        }

        public Builder minEventRateDiff(double minEventRateDiff) {
            this.minEventRateDiff = minEventRateDiff;
            return this;
        }

        public Builder minBinSize(double minBinSize) {
            this.minBinSize = minBinSize;
            return this;
        }

        public Builder maxBins(int maxBins) {
            this.maxBins = maxBins;
            return this;
        }

        public Builder minBins(int minBins) {
            this.minBins = minBins;
            return this;
        }

        public Builder weights(ObjectiveWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder referenceCohort(String referenceCohort) {
            this.referenceCohort = referenceCohort;
            return this;
        }

        public Builder checkStability(boolean checkStability) {
            this.checkStability = checkStability;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder psiAggregation(PsiAggregation psiAggregation) {
            this.psiAggregation = psiAggregation;
            return this;
        }

        public Builder penalizeInversions(boolean penalizeInversions) {
            this.penalizeInversions = penalizeInversions;
            return this;
        }

        public Builder penalizeLowFrequency(boolean penalizeLowFrequency) {
            this.penalizeLowFrequency = penalizeLowFrequency;
            return this;
        }

        public Builder lowFrequencyThreshold(int lowFrequencyThreshold) {
            this.lowFrequencyThreshold = lowFrequencyThreshold;
            return this;
        }

        public Builder penalty(double penalty) {
            this.penalty = penalty;
            return this;
        }

        public Builder rareThreshold(double rareThreshold) {
            this.rareThreshold = rareThreshold;
            return this;
        }

        public BinningConfig build() {
            return new BinningConfig(monotonic, minEventRateDiff, minBinSize, maxBins, minBins, weights,
                    referenceCohort, checkStability, epsilon, psiAggregation, penalizeInversions,
                    penalizeLowFrequency, lowFrequencyThreshold, penalty, rareThreshold);
        }
    }

}
