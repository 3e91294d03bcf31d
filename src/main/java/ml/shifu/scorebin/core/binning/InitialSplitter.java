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

import java.util.List;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;

/**
 * Generates the initial fine-grained bins which {@link MonotonicRefiner} starts from.
 * 
 * <p>
 * Implementations must return an exhaustive, non-overlapping partition of the feature domain, and should be
 * deterministic for the same observations and config.
 */
public interface InitialSplitter {

    /**
     * @param observations
     *            observations of a single feature kind
     * @param config
     *            binning config, {@code maxBins} and {@code rareThreshold} are read by built-in splitters
     * @return the initial bin set
     */
    BinSet split(List<Observation> observations, BinningConfig config);
}
