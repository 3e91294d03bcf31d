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
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.InitialSplitter;
import ml.shifu.scorebin.exception.BinningException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits several named configs on the same observations and lines up their metrics. A config which can not be fitted
 * gets a failed row, the others still run.
 */
public class BinComparator {

    private static final Logger LOG = LoggerFactory.getLogger(BinComparator.class);

    private final InitialSplitter splitter;

    public BinComparator() {
        this(null);
    }

    /**
     * @param splitter
     *            splitter shared by all configs, null for the default one of the feature kind
     */
    public BinComparator(InitialSplitter splitter) {
        this.splitter = splitter;
    }

    /**
     * @param observations
     *            observations of one feature
     * @param configs
     *            configs by name, rows keep the iteration order of the map
     * @return one row per config
     */
    public List<ComparisonRow> compare(List<Observation> observations, Map<String, BinningConfig> configs) {
        List<ComparisonRow> rows = new ArrayList<ComparisonRow>(configs.size());
        for(Entry<String, BinningConfig> entry: configs.entrySet()) {
            try {
                BinningResult result = ScoreBinner.fit(observations, entry.getValue(), splitter);
                rows.add(ComparisonRow.success(entry.getKey(), result));
            } catch (BinningException e) {
                LOG.warn("Config {} can not be fitted: {}", entry.getKey(), e.getMessage());
                rows.add(ComparisonRow.failure(entry.getKey(), e.getError(), e.getMessage()));
            }
        }
        return rows;
    }
}
