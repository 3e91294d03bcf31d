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
package ml.shifu.scorebin.core.search;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.RandomDataGenerator;

/**
 * Uniform random sampling over a {@link SearchSpace}. With the same seed the same vectors are proposed.
 */
public class RandomSearch implements HyperParamSampler {

    private final SearchSpace space;

    private final RandomDataGenerator random;

    public RandomSearch(SearchSpace space, long seed) {
        this.space = space;
        this.random = new RandomDataGenerator();
        this.random.reSeed(seed);
    }

    @Override
    public synchronized List<HyperParams> propose(int nTrials) {
        List<HyperParams> proposals = new ArrayList<HyperParams>(Math.max(nTrials, 0));
        for(int i = 0; i < nTrials; i++) {
            int maxBins = space.getMaxBinsLow() == space.getMaxBinsHigh() ? space.getMaxBinsLow() : random.nextInt(
                    space.getMaxBinsLow(), space.getMaxBinsHigh());
            proposals.add(new HyperParams(maxBins, uniform(space.getMinBinSizeLow(), space.getMinBinSizeHigh()),
                    uniform(space.getMinEventRateDiffLow(), space.getMinEventRateDiffHigh())));
        }
        return proposals;
    }

    private double uniform(double low, double high) {
        return low == high ? low : random.nextUniform(low, high);
    }
}
