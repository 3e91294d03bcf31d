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
package ml.shifu.scorebin.core.binning.obj;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.apache.commons.lang.StringUtils;

/**
 * Ordered, immutable list of bins of one feature. Ordinal position of a bin is its index in the list.
 *
 * <p>
 * Numerical bin sets are contiguous from -Inf to +Inf with strictly increasing thresholds, categorical bin sets are
 * pairwise disjoint. Both are checked at construction, so any {@link BinSet} is an exhaustive partition of its
 * domain (for categorical, of the categories it lists).
 */
public final class BinSet {

    private final List<AbstractBinInfo> bins;

    private final boolean categorical;

    /**
     * Left thresholds of numerical bins for binary search.
     */
    private final double[] leftThresholds;

    /**
     * Category to bin index for categorical bins.
     */
    private final Map<String, Integer> categoryIndex;

    private BinSet(List<? extends AbstractBinInfo> bins) {
        if(bins == null || bins.isEmpty()) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_PARTITION, "Bin set should not be empty.");
        }
        this.bins = Collections.unmodifiableList(new ArrayList<AbstractBinInfo>(bins));
        this.categorical = bins.get(0).isCategorical();
        for(AbstractBinInfo bin: bins) {
            if(bin.isCategorical() != this.categorical) {
                throw new BinningException(BinningErrorCode.ERROR_MIXED_FEATURE_TYPE,
                        "Numerical and categorical bins can not be mixed in one bin set.");
            }
        }

        if(this.categorical) {
            this.leftThresholds = null;
            this.categoryIndex = new HashMap<String, Integer>();
            for(int i = 0; i < this.bins.size(); i++) {
                for(String category: ((CategoricalBinInfo) this.bins.get(i)).getValues()) {
                    if(this.categoryIndex.put(category, i) != null) {
                        throw new BinningException(BinningErrorCode.ERROR_INVALID_PARTITION, "Category " + category
                                + " belongs to more than one bin.");
                    }
                }
            }
        } else {
            this.categoryIndex = null;
            this.leftThresholds = new double[this.bins.size()];
            for(int i = 0; i < this.bins.size(); i++) {
                NumBinInfo bin = (NumBinInfo) this.bins.get(i);
                this.leftThresholds[i] = bin.getLeftThreshold();
                if(i > 0 && Double.compare(((NumBinInfo) this.bins.get(i - 1)).getRightThreshold(),
                        bin.getLeftThreshold()) != 0) {
                    throw new BinningException(BinningErrorCode.ERROR_INVALID_PARTITION, "Bins " + (i - 1) + " and "
                            + i + " are not contiguous: " + this.bins.get(i - 1) + ", " + bin);
                }
            }
            if(this.leftThresholds[0] != Double.NEGATIVE_INFINITY
                    || ((NumBinInfo) this.bins.get(this.bins.size() - 1)).getRightThreshold() != Double.POSITIVE_INFINITY) {
                throw new BinningException(BinningErrorCode.ERROR_INVALID_PARTITION,
                        "Numerical bins should cover (-Infinity, +Infinity), but got " + this);
            }
        }
    }

    public static BinSet of(List<? extends AbstractBinInfo> bins) {
        return new BinSet(bins);
    }

    /**
     * @param thresholds
     *            inner cut points, see {@link NumBinInfo#constructNumBinInfos(Collection)}
     * @return numerical bin set
     */
    public static BinSet fromThresholds(Collection<Double> thresholds) {
        return new BinSet(NumBinInfo.constructNumBinInfos(thresholds));
    }

    public int size() {
        return bins.size();
    }

    public AbstractBinInfo get(int index) {
        return bins.get(index);
    }

    public List<AbstractBinInfo> getBins() {
        return bins;
    }

    public boolean isCategorical() {
        return categorical;
    }

    /**
     * @return inner thresholds of a numerical bin set, the left threshold of every bin but the first
     */
    public List<Double> getThresholds() {
        if(categorical) {
            throw new IllegalStateException("Categorical bin set has no thresholds.");
        }
        List<Double> thresholds = new ArrayList<Double>(leftThresholds.length - 1);
        for(int i = 1; i < leftThresholds.length; i++) {
            thresholds.add(leftThresholds[i]);
        }
        return thresholds;
    }

    /**
     * @return if {@link #indexOf(Observation)} would find a bin for the observation
     */
    public boolean covers(Observation observation) {
        if(observation.isCategorical() != this.categorical) {
            return false;
        }
        return !categorical || categoryIndex.containsKey(observation.getCategoricalValue());
    }

    /**
     * Locate the bin of an observation.
     *
     * @param observation
     *            the observation
     * @return ordinal of the bin which accepts the observation
     * @throws BinningException
     *             if the observation is of the other feature type or its category is not covered
     */
    public int indexOf(Observation observation) {
        if(observation.isCategorical() != this.categorical) {
            throw new BinningException(BinningErrorCode.ERROR_MIXED_FEATURE_TYPE, "Observation " + observation
                    + " does not match a " + (categorical ? "categorical" : "numerical") + " bin set.");
        }

        if(categorical) {
            Integer index = categoryIndex.get(observation.getCategoricalValue());
            if(index == null) {
                throw new BinningException(BinningErrorCode.ERROR_INVALID_PARTITION, "Category "
                        + observation.getCategoricalValue() + " is not covered by any bin.");
            }
            return index;
        }

        // largest i with leftThresholds[i] <= value, leftThresholds[0] is -Inf
        double value = observation.getNumericValue();
        int low = 0, high = leftThresholds.length - 1;
        while(low < high) {
            int mid = (low + high + 1) >>> 1;
            if(leftThresholds[mid] <= value) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    /**
     * Merge bin {@code leftIndex} with bin {@code leftIndex + 1}.
     *
     * @param leftIndex
     *            ordinal of the left bin of the pair
     * @return a new bin set with one bin less
     */
    public BinSet mergeAt(int leftIndex) {
        if(leftIndex < 0 || leftIndex >= bins.size() - 1) {
            throw new IndexOutOfBoundsException("Can not merge bin " + leftIndex + " in a bin set of size "
                    + bins.size());
        }
        List<AbstractBinInfo> merged = new ArrayList<AbstractBinInfo>(bins.size() - 1);
        for(int i = 0; i < bins.size(); i++) {
            if(i == leftIndex) {
                merged.add(bins.get(i).mergeRight(bins.get(i + 1)));
                i++;
            } else {
                merged.add(bins.get(i));
            }
        }
        return new BinSet(merged);
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        return (obj instanceof BinSet) && bins.equals(((BinSet) obj).bins);
    }

    @Override
    public int hashCode() {
        return bins.hashCode();
    }

    @Override
    public String toString() {
        return "BinSet [" + StringUtils.join(bins, ", ") + "]";
    }
}
