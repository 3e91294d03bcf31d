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
package ml.shifu.scorebin.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.util.Constants;

/**
 * Weight of evidence of each final bin, used to encode a feature value for scorecard models.
 */
public final class WoeTable {

    private final BinSet binSet;

    private final List<Double> woes;

    /**
     * Bin taking categories unseen at fit time, -1 if none.
     */
    private final int rareIndex;

    public WoeTable(BinSet binSet, List<Double> woes) {
        if(binSet.size() != woes.size()) {
            throw new IllegalArgumentException("WoE size " + woes.size() + " does not match bin size "
                    + binSet.size());
        }
        this.binSet = binSet;
        this.woes = Collections.unmodifiableList(new ArrayList<Double>(woes));
        this.rareIndex = binSet.isCategorical() ? locateRareBin(binSet) : -1;
    }

    private static int locateRareBin(BinSet binSet) {
        Observation rare = Observation.categorical(Constants.RARE_CATEGORY, 0, Constants.RARE_CATEGORY);
        return binSet.covers(rare) ? binSet.indexOf(rare) : -1;
    }

    public double getWoe(int binIndex) {
        return woes.get(binIndex);
    }

    public List<Double> getWoes() {
        return woes;
    }

    public BinSet getBinSet() {
        return binSet;
    }

    /**
     * @param observation
     *            numeric or categorical observation of the fitted feature
     * @return WoE of the bin the observation falls in; categories unseen at fit time get the rare bin's WoE when
     *         there is one
     */
    public double woeOf(Observation observation) {
        if(rareIndex >= 0 && !binSet.covers(observation)) {
            return woes.get(rareIndex);
        }
        return woes.get(binSet.indexOf(observation));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WoeTable [");
        for(int i = 0; i < woes.size(); i++) {
            if(i > 0) {
                sb.append(", ");
            }
            sb.append(binSet.get(i).getLabel()).append('=').append(woes.get(i));
        }
        return sb.append(']').toString();
    }
}
