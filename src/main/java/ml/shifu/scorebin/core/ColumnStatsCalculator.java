/*
 * Copyright [2012-2014] PayPal Software Foundation
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
package ml.shifu.scorebin.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ml.shifu.scorebin.core.stability.GuardSubstitution;
import ml.shifu.scorebin.exception.InsufficientDataException;

/**
 * To compute ks, iv and woe values over ordered bins.
 *
 * <p>
 * WoE of bin i is {@code ln(eventShare_i / nonEventShare_i)}. Shares under epsilon are floored to epsilon in both
 * the difference and the logarithm of the IV term, which keeps every term non-negative and IV exactly 0 for identical
 * shares.
 */
public final class ColumnStatsCalculator {

    private ColumnStatsCalculator() {
    }

    /**
     * @param negative
     *            non-event count per bin
     * @param positive
     *            event count per bin
     * @param epsilon
     *            floor of event and non-event shares
     * @return ks (in [0, 1]), iv and woe per bin
     * @throws InsufficientDataException
     *             if there is no event or no non-event at all
     */
    public static ColumnMetrics calculateColumnMetrics(long[] negative, long[] positive, double epsilon) {
        assert negative != null && positive != null && negative.length == positive.length;

        int numBins = negative.length;

        double sumN = 0.0;
        double sumP = 0.0;
        double cumN = 0.0;
        double cumP = 0.0;
        double iv = 0.0;
        double ks = 0.0;

        for(int i = 0; i < numBins; i++) {
            sumN += negative[i];
            sumP += positive[i];
        }

        if(sumN == 0 || sumP == 0) {
            throw new InsufficientDataException("IV and WoE need both events and non-events, but got " + (long) sumP
                    + " events and " + (long) sumN + " non-events.");
        }

        List<Double> binningWoe = new ArrayList<Double>(numBins);
        List<GuardSubstitution> substitutions = new ArrayList<GuardSubstitution>();

        for(int i = 0; i < numBins; i++) {
            double p = positive[i] / sumP;
            double n = negative[i] / sumN;
            double flooredP = floor(p, epsilon, i, "event", substitutions);
            double flooredN = floor(n, epsilon, i, "nonEvent", substitutions);
            double woePerBin = Math.log(flooredP / flooredN);
            binningWoe.add(woePerBin);
            iv += (flooredP - flooredN) * woePerBin;
            cumP += p;
            cumN += n;
            double tmpKS = Math.abs(cumP - cumN);
            if(ks < tmpKS) {
                ks = tmpKS;
            }
        }

        return new ColumnMetrics(ks, iv, binningWoe, substitutions);
    }

    /**
     * KS only, max distance between cumulative event and non-event distributions over ordered bins.
     *
     * @param negative
     *            non-event count per bin
     * @param positive
     *            event count per bin
     * @return ks in [0, 1]
     * @throws InsufficientDataException
     *             if there is no event or no non-event at all
     */
    public static double calculateKs(long[] negative, long[] positive) {
        assert negative != null && positive != null && negative.length == positive.length;
        double sumN = 0.0;
        double sumP = 0.0;
        for(int i = 0; i < negative.length; i++) {
            sumN += negative[i];
            sumP += positive[i];
        }
        if(sumN == 0 || sumP == 0) {
            throw new InsufficientDataException("KS needs both events and non-events, but got " + (long) sumP
                    + " events and " + (long) sumN + " non-events.");
        }

        double cumN = 0.0;
        double cumP = 0.0;
        double ks = 0.0;
        for(int i = 0; i < negative.length; i++) {
            cumP += positive[i] / sumP;
            cumN += negative[i] / sumN;
            ks = Math.max(ks, Math.abs(cumP - cumN));
        }
        return ks;
    }

    private static double floor(double share, double epsilon, int bin, String name,
            List<GuardSubstitution> substitutions) {
        if(share < epsilon) {
            substitutions.add(new GuardSubstitution(GuardSubstitution.IV, bin, null, name, share, epsilon));
            return epsilon;
        }
        return share;
    }

    public static class ColumnMetrics {

        private final double ks;

        private final double iv;

        private final List<Double> binningWoe;

        private final List<GuardSubstitution> substitutions;

        public ColumnMetrics(double ks, double iv, List<Double> binningWoe, List<GuardSubstitution> substitutions) {
            this.ks = ks;
            this.iv = iv;
            this.binningWoe = Collections.unmodifiableList(binningWoe);
            this.substitutions = Collections.unmodifiableList(substitutions);
        }

        /**
         * @return the ks
         */
        public double getKs() {
            return ks;
        }

        /**
         * @return the iv
         */
        public double getIv() {
            return iv;
        }

        /**
         * @return the binningWoe
         */
        public List<Double> getBinningWoe() {
            return binningWoe;
        }

        /**
         * @return shares floored to epsilon
         */
        public List<GuardSubstitution> getSubstitutions() {
            return substitutions;
        }
    }

}
