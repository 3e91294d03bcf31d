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

/**
 * One merge done by {@link MonotonicRefiner}, kept for audit.
 */
public final class MergeStep {

    /**
     * Why a pair was merged, in the order the refiner checks them.
     */
    public static enum Reason {
        EMPTY_BIN, MONOTONICITY, MIN_EVENT_RATE_DIFF, MIN_BIN_SIZE
    }

    private final int iteration;

    /**
     * Ordinal of the left bin of the merged pair, before merging.
     */
    private final int leftIndex;

    private final Reason reason;

    private final double leftEventRate;

    private final double rightEventRate;

    private final int binCountAfter;

    public MergeStep(int iteration, int leftIndex, Reason reason, double leftEventRate, double rightEventRate,
            int binCountAfter) {
        this.iteration = iteration;
        this.leftIndex = leftIndex;
        this.reason = reason;
        this.leftEventRate = leftEventRate;
        this.rightEventRate = rightEventRate;
        this.binCountAfter = binCountAfter;
    }

    public int getIteration() {
        return iteration;
    }

    public int getLeftIndex() {
        return leftIndex;
    }

    public Reason getReason() {
        return reason;
    }

    public double getLeftEventRate() {
        return leftEventRate;
    }

    public double getRightEventRate() {
        return rightEventRate;
    }

    public int getBinCountAfter() {
        return binCountAfter;
    }

    @Override
    public String toString() {
        return "MergeStep [#" + iteration + " bins " + leftIndex + "+" + (leftIndex + 1) + ", " + reason + ", rates "
                + leftEventRate + "/" + rightEventRate + ", " + binCountAfter + " bins left]";
    }
}
