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

import ml.shifu.scorebin.core.binning.obj.AbstractBinInfo;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.binning.obj.NumBinInfo;

import org.testng.Assert;
import org.testng.annotations.Test;

public class EntropyBinMergerTest {

    @Test
    public void testMergeSimilarNeighbours() {
        List<NumBinInfo> bins = NumBinInfo.constructNumBinInfos(Arrays.asList(1d, 2d, 3d));
        // bins 0, 1 pure non-event, bins 2, 3 pure event
        List<AbstractBinInfo> merged = new EntropyBinMerger(2).merge(bins, new long[] { 50, 50, 0, 0 }, new long[] {
                0, 0, 50, 50 });
        Assert.assertEquals(BinSet.of(merged).getThresholds(), Arrays.asList(2d));
    }

    @Test
    public void testEmptyBinsAreFolded() {
        List<NumBinInfo> bins = NumBinInfo.constructNumBinInfos(Arrays.asList(1d, 2d, 3d, 4d));
        List<AbstractBinInfo> merged = new EntropyBinMerger(10).merge(bins, new long[] { 0, 10, 0, 0, 10 },
                new long[] { 0, 5, 0, 0, 1 });
        // first empty bin goes right, the others left
        Assert.assertEquals(BinSet.of(merged).getThresholds(), Arrays.asList(4d));
    }

    @Test
    public void testNothingToMerge() {
        List<NumBinInfo> bins = NumBinInfo.constructNumBinInfos(Arrays.asList(1d));
        List<AbstractBinInfo> merged = new EntropyBinMerger(5).merge(bins, new long[] { 3, 4 }, new long[] { 1, 2 });
        Assert.assertEquals(merged.size(), 2);
    }
}
