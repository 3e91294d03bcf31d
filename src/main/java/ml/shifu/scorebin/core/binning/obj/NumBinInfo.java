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
import java.util.List;
import java.util.TreeSet;

/**
 * Numerical bin, the half-open interval [leftThreshold, rightThreshold).
 */
public final class NumBinInfo extends AbstractBinInfo {

    private final double leftThreshold;
    private final double rightThreshold;

    public NumBinInfo(double leftThreshold, double rightThreshold) {
        if(!(leftThreshold < rightThreshold)) {
            throw new IllegalArgumentException("Left threshold " + leftThreshold
                    + " should be less than right threshold " + rightThreshold);
        }
        this.leftThreshold = leftThreshold;
        this.rightThreshold = rightThreshold;
    }

    public double getLeftThreshold() {
        return leftThreshold;
    }

    public double getRightThreshold() {
        return rightThreshold;
    }

    /**
     * Construct the exhaustive bin list (-Inf, t1), [t1, t2) ... [tn, +Inf) from inner thresholds. Thresholds are
     * sorted and de-duplicated, non-finite ones are skipped.
     *
     * @param thresholds
     *            inner cut points
     * @return ordered bins covering the whole real line
     */
    public static List<NumBinInfo> constructNumBinInfos(Collection<Double> thresholds) {
        TreeSet<Double> sorted = new TreeSet<Double>();
        sorted.add(Double.NEGATIVE_INFINITY);
        for(Double threshold: thresholds) {
            if(threshold != null && !threshold.isNaN() && !threshold.isInfinite()) {
                sorted.add(threshold);
            }
        }
        sorted.add(Double.POSITIVE_INFINITY);

        List<Double> cuts = new ArrayList<Double>(sorted);
        List<NumBinInfo> binInfos = new ArrayList<NumBinInfo>(cuts.size() - 1);
        for(int i = 0; i < cuts.size() - 1; i++) {
            binInfos.add(new NumBinInfo(cuts.get(i), cuts.get(i + 1)));
        }
        return binInfos;
    }

    @Override
    public NumBinInfo mergeRight(AbstractBinInfo next) {
        if(!(next instanceof NumBinInfo)) {
            throw new IllegalArgumentException("NumBinInfo could only be merged with NumBinInfo.");
        }
        NumBinInfo right = (NumBinInfo) next;
        return new NumBinInfo(Math.min(this.leftThreshold, right.leftThreshold), Math.max(this.rightThreshold,
                right.rightThreshold));
    }

    @Override
    public boolean isCategorical() {
        return false;
    }

    @Override
    public String getLabel() {
        return "[" + this.leftThreshold + ", " + this.rightThreshold + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof NumBinInfo)) {
            return false;
        }
        NumBinInfo other = (NumBinInfo) obj;
        return Double.compare(leftThreshold, other.leftThreshold) == 0
                && Double.compare(rightThreshold, other.rightThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.valueOf(leftThreshold).hashCode() + Double.valueOf(rightThreshold).hashCode();
    }
}
