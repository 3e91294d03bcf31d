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

import java.util.Arrays;
import java.util.List;

import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.exception.InsufficientDataException;

import org.apache.commons.collections.CollectionUtils;

/**
 * Shared checks and counting of built-in {@link InitialSplitter}s.
 */
public abstract class AbstractSplitter implements InitialSplitter {

    /**
     * Make sure observations are present and all of the expected kind.
     */
    protected void checkObservations(List<Observation> observations, boolean categorical) {
        if(CollectionUtils.isEmpty(observations)) {
            throw new InsufficientDataException("No observation to split.");
        }
        for(Observation observation: observations) {
            if(observation.isCategorical() != categorical) {
                throw new BinningException(BinningErrorCode.ERROR_MIXED_FEATURE_TYPE, getClass().getSimpleName()
                        + " expects " + (categorical ? "categorical" : "numerical") + " observations, but got "
                        + observation);
            }
        }
    }

    protected double[] sortedValues(List<Observation> observations) {
        double[] values = new double[observations.size()];
        for(int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).getNumericValue();
        }
        Arrays.sort(values);
        return values;
    }

    /**
     * Count non-events and events of each bin.
     * 
     * @return {@code [0]} non-event counts, {@code [1]} event counts
     */
    protected long[][] countByBin(BinSet binSet, List<Observation> observations) {
        long[][] counts = new long[2][binSet.size()];
        for(Observation observation: observations) {
            counts[observation.getLabel()][binSet.indexOf(observation)]++;
        }
        return counts;
    }
}
