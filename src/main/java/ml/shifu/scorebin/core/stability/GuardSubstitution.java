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

/**
 * Record of one share floored to epsilon before taking a logarithm. Floors bias PSI, IV and WoE of near-empty bins,
 * so every substitution is reported with the metrics instead of being applied silently.
 */
public final class GuardSubstitution {

    public static final String PSI = "PSI";
    public static final String IV = "IV";

    /**
     * Metric the share was used for, {@link #PSI} or {@link #IV}.
     */
    private final String metric;

    private final int binIndex;

    /**
     * Cohort of the share, null for shares over all cohorts.
     */
    private final String cohortId;

    /**
     * Which share was floored, like 'cohort', 'reference', 'event' or 'nonEvent'.
     */
    private final String share;

    private final double originalValue;

    private final double substitutedValue;

    public GuardSubstitution(String metric, int binIndex, String cohortId, String share, double originalValue,
            double substitutedValue) {
        this.metric = metric;
        this.binIndex = binIndex;
        this.cohortId = cohortId;
        this.share = share;
        this.originalValue = originalValue;
        this.substitutedValue = substitutedValue;
    }

    public String getMetric() {
        return metric;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public String getCohortId() {
        return cohortId;
    }

    public String getShare() {
        return share;
    }

    public double getOriginalValue() {
        return originalValue;
    }

    public double getSubstitutedValue() {
        return substitutedValue;
    }

    @Override
    public String toString() {
        return metric + "(bin=" + binIndex + (cohortId == null ? "" : ", cohort=" + cohortId) + ", " + share + ": "
                + originalValue + " -> " + substitutedValue + ")";
    }
}
