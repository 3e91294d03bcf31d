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

import ml.shifu.scorebin.core.binning.obj.AbstractBinInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges adjacent bins down to an expected bin number. At each step the adjacent pair whose merge increases the
 * weighted label entropy least is merged, so the bins keep as much of the label information as possible.
 * 
 * <p>
 * Bins without any observation are folded into their nearest non-empty neighbour first.
 */
public class EntropyBinMerger {

    private static final Logger LOG = LoggerFactory.getLogger(EntropyBinMerger.class);

    private static final double EPS = 1e-6;

    private final int expectedBinningNum;

    public EntropyBinMerger(int expectedBinNum) {
        this.expectedBinningNum = expectedBinNum;
    }

    /**
     * @param binInfos
     *            ordered adjacent bins
     * @param negative
     *            non-event count of each bin
     * @param positive
     *            event count of each bin
     * @return merged bins, at most the expected number unless there is nothing left to merge
     */
    public List<AbstractBinInfo> merge(List<? extends AbstractBinInfo> binInfos, long[] negative, long[] positive) {
        List<BinCounter> counters = new ArrayList<BinCounter>(binInfos.size());
        for(int i = 0; i < binInfos.size(); i++) {
            counters.add(new BinCounter(binInfos.get(i), negative[i], positive[i]));
        }

        counters = combineEmptyBin(counters);

        if(counters.size() > this.expectedBinningNum) {
            double totalInstCnt = 0d;
            for(BinCounter counter: counters) {
                totalInstCnt += counter.getTotalInstCnt();
            }
            adjustBinInfos(counters, totalInstCnt);
        }

        List<AbstractBinInfo> merged = new ArrayList<AbstractBinInfo>(counters.size());
        for(BinCounter counter: counters) {
            merged.add(counter.binInfo);
        }
        LOG.debug("Merged {} bins into {} bins.", binInfos.size(), merged.size());
        return merged;
    }

    private List<BinCounter> combineEmptyBin(List<BinCounter> counters) {
        List<BinCounter> combined = new ArrayList<BinCounter>(counters.size());
        BinCounter pending = null;
        for(BinCounter counter: counters) {
            if(pending != null) {
                counter = pending.mergeRight(counter);
                pending = null;
            }
            if(counter.getTotalInstCnt() == 0) {
                if(combined.isEmpty()) {
                    pending = counter;
                } else {
                    BinCounter last = combined.remove(combined.size() - 1);
                    combined.add(last.mergeRight(counter));
                }
            } else {
                combined.add(counter);
            }
        }
        if(pending != null) {
            // all bins are empty
            combined.add(pending);
        }
        return combined;
    }

    private void adjustBinInfos(List<BinCounter> counters, double totalInstCnt) {
        while(counters.size() > this.expectedBinningNum) {
            int pos = getBestMergeNode(counters, totalInstCnt);
            if(pos > 0) {
                counters.set(pos - 1, counters.get(pos - 1).mergeRight(counters.get(pos)));
                counters.remove(pos);
            } else {
                break;
            }
        }
    }

    /**
     * @return position of the right bin of the best pair to merge
     */
    private int getBestMergeNode(List<BinCounter> counters, double totalInstCnt) {
        double entropyIncrement = Double.MAX_VALUE;
        int nodeIndexToMerge = 0;
        for(int pos = 1; pos < counters.size(); pos++) {
            BinCounter current = counters.get(pos - 1);
            BinCounter next = counters.get(pos);
            double increment = getInfoValue(current.mergeRight(next), totalInstCnt)
                    - getInfoValue(current, totalInstCnt) - getInfoValue(next, totalInstCnt);
            if(increment < entropyIncrement) {
                nodeIndexToMerge = pos;
                entropyIncrement = increment;
            }
        }
        return nodeIndexToMerge;
    }

    private double getInfoValue(BinCounter counter, double totalInstCnt) {
        double total = counter.getTotalInstCnt();
        if(total == 0d) {
            return 0d;
        }
        double percent = total / totalInstCnt;
        double positiveRate = (counter.positive + EPS) / total;
        double negativeRate = (counter.negative + EPS) / total;
        return -1 * percent * (positiveRate * log2(positiveRate) + negativeRate * log2(negativeRate));
    }

    private double log2(double ratio) {
        return Math.log(ratio) / Math.log(2.0d);
    }

    private static class BinCounter {
        private final AbstractBinInfo binInfo;
        private final long negative;
        private final long positive;

        private BinCounter(AbstractBinInfo binInfo, long negative, long positive) {
            this.binInfo = binInfo;
            this.negative = negative;
            this.positive = positive;
        }

        private long getTotalInstCnt() {
            return negative + positive;
        }

        private BinCounter mergeRight(BinCounter next) {
            return new BinCounter(binInfo.mergeRight(next.binInfo), negative + next.negative, positive
                    + next.positive);
        }
    }
}
