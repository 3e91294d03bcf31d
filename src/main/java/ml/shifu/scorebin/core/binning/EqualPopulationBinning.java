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
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;

/**
 * EqualPopulationBinning class, cuts the sorted values at quantiles so each bin holds about the same population.
 * Duplicated cut points are removed, so heavily tied features may get fewer bins than expected.
 */
public class EqualPopulationBinning extends AbstractSplitter {

    @Override
    public BinSet split(List<Observation> observations, BinningConfig config) {
        checkObservations(observations, false);
        return BinSet.fromThresholds(quantileThresholds(sortedValues(observations), config.getMaxBins()));
    }

    /**
     * @param sorted
     *            sorted values
     * @param binningNum
     *            expected bin number
     * @return strictly increasing inner thresholds, each one above the min value
     */
    static List<Double> quantileThresholds(double[] sorted, int binningNum) {
        List<Double> thresholds = new ArrayList<Double>();
        double last = sorted[0];
        for(int k = 1; k < binningNum; k++) {
            int index = (int) ((long) k * sorted.length / binningNum);
            double threshold = sorted[Math.min(index, sorted.length - 1)];
            if(threshold > last) {
                thresholds.add(threshold);
                last = threshold;
            }
        }
        return thresholds;
    }
}
