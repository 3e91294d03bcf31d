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
 * EqualIntervalBinning class, cuts [min, max] into {@code maxBins} intervals of the same width. Some intervals may be
 * empty, they are merged later by the refiner.
 */
public class EqualIntervalBinning extends AbstractSplitter {

    @Override
    public BinSet split(List<Observation> observations, BinningConfig config) {
        checkObservations(observations, false);

        double maxVal = -Double.MAX_VALUE;
        double minVal = Double.MAX_VALUE;
        for(Observation observation: observations) {
            maxVal = Math.max(maxVal, observation.getNumericValue());
            minVal = Math.min(minVal, observation.getNumericValue());
        }

        List<Double> binBorders = new ArrayList<Double>();
        if(maxVal > minVal) {
            double binInterval = (maxVal - minVal) / config.getMaxBins();
            for(int i = 1; i < config.getMaxBins(); i++) {
                binBorders.add(minVal + i * binInterval);
            }
        }
        return BinSet.fromThresholds(binBorders);
    }
}
