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
import ml.shifu.scorebin.util.Constants;
import ml.shifu.scorebin.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervised numerical splitter. Values are pre-binned by population into {@code scorebin.prebin.count} bins, then
 * adjacent pre-bins are merged by {@link EntropyBinMerger} down to {@code maxBins}.
 */
public class DynamicBinning extends AbstractSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(DynamicBinning.class);

    private final int preBinCount;

    public DynamicBinning() {
        this(Environment.getInt(Constants.SCOREBIN_PREBIN_COUNT, Constants.DEFAULT_PREBIN_COUNT));
    }

    public DynamicBinning(int preBinCount) {
        if(preBinCount < 1) {
            throw new IllegalArgumentException("Pre-bin count should be positive, but got " + preBinCount);
        }
        this.preBinCount = preBinCount;
    }

    @Override
    public BinSet split(List<Observation> observations, BinningConfig config) {
        checkObservations(observations, false);

        int expected = Math.max(config.getMaxBins(), this.preBinCount);
        BinSet preBins = BinSet.fromThresholds(EqualPopulationBinning.quantileThresholds(sortedValues(observations),
                expected));
        if(preBins.size() <= config.getMaxBins()) {
            return preBins;
        }

        long[][] counts = countByBin(preBins, observations);
        BinSet merged = BinSet.of(new EntropyBinMerger(config.getMaxBins()).merge(preBins.getBins(), counts[0],
                counts[1]));
        LOG.debug("Dynamic binning from {} pre-bins to {} bins: {}", preBins.size(), merged.size(), merged);
        return merged;
    }

    public int getPreBinCount() {
        return preBinCount;
    }
}
