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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.AbstractBinInfo;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.binning.obj.CategoricalBinInfo;
import ml.shifu.scorebin.util.Constants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Categorical splitter.
 * 
 * <ol>
 * <li>Categories with population share below {@code rareThreshold} are grouped into one bin, which also takes
 * {@link Constants#RARE_CATEGORY} so unseen categories can be resolved to it.</li>
 * <li>Groups are ordered by event rate, ascending, so adjacency means similar risk.</li>
 * <li>Adjacent groups are merged by {@link EntropyBinMerger} down to {@code maxBins}.</li>
 * </ol>
 */
public class CategoricalBinning extends AbstractSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(CategoricalBinning.class);

    @Override
    public BinSet split(List<Observation> observations, BinningConfig config) {
        checkObservations(observations, true);

        // sorted for determinism
        Map<String, long[]> categoryCounts = new TreeMap<String, long[]>();
        for(Observation observation: observations) {
            long[] counts = categoryCounts.get(observation.getCategoricalValue());
            if(counts == null) {
                counts = new long[2];
                categoryCounts.put(observation.getCategoricalValue(), counts);
            }
            counts[observation.getLabel()]++;
        }

        double rareCount = config.getRareThreshold() * observations.size();
        List<Group> groups = new ArrayList<Group>();
        Group rare = null;
        for(Entry<String, long[]> entry: categoryCounts.entrySet()) {
            long[] counts = entry.getValue();
            if(counts[0] + counts[1] < rareCount) {
                if(rare == null) {
                    rare = new Group();
                    if(!categoryCounts.containsKey(Constants.RARE_CATEGORY)) {
                        rare.values.add(Constants.RARE_CATEGORY);
                    }
                }
                rare.add(entry.getKey(), counts);
            } else {
                groups.add(new Group(entry.getKey(), counts));
            }
        }
        if(rare != null) {
            LOG.debug("{} rare categories are grouped: {}", rare.values.size(), rare.values);
            groups.add(rare);
        }

        Collections.sort(groups, new Comparator<Group>() {
            @Override
            public int compare(Group o1, Group o2) {
                int cmp = Double.compare(o1.getEventRate(), o2.getEventRate());
                return cmp != 0 ? cmp : o1.values.get(0).compareTo(o2.values.get(0));
            }
        });

        List<CategoricalBinInfo> binInfos = new ArrayList<CategoricalBinInfo>(groups.size());
        long[] negative = new long[groups.size()];
        long[] positive = new long[groups.size()];
        for(int i = 0; i < groups.size(); i++) {
            binInfos.add(new CategoricalBinInfo(groups.get(i).values));
            negative[i] = groups.get(i).negative;
            positive[i] = groups.get(i).positive;
        }

        List<AbstractBinInfo> merged = new EntropyBinMerger(config.getMaxBins()).merge(binInfos, negative, positive);
        return BinSet.of(merged);
    }

    private static class Group {
        private final List<String> values = new ArrayList<String>();
        private long negative;
        private long positive;

        private Group() {
        }

        private Group(String value, long[] counts) {
            add(value, counts);
        }

        private void add(String value, long[] counts) {
            values.add(value);
            negative += counts[0];
            positive += counts[1];
        }

        private double getEventRate() {
            return (double) positive / (negative + positive);
        }
    }
}
