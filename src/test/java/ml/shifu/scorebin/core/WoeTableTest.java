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

import java.util.Arrays;

import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.binning.obj.CategoricalBinInfo;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class WoeTableTest {

    @Test
    public void testNumeric() {
        WoeTable table = new WoeTable(BinSet.fromThresholds(Arrays.asList(1d)), Arrays.asList(-0.5d, 0.7d));
        Assert.assertEquals(table.woeOf(Observation.numeric(-3d, 0, "c")), -0.5d);
        Assert.assertEquals(table.woeOf(Observation.numeric(3d, 0, "c")), 0.7d);
        Assert.assertEquals(table.getWoe(1), 0.7d);
    }

    @Test
    public void testUnseenCategoryGoesToRareBin() {
        BinSet binSet = BinSet.of(Arrays.asList(new CategoricalBinInfo(Arrays.asList("a")), new CategoricalBinInfo(
                Arrays.asList(Constants.RARE_CATEGORY, "b"))));
        WoeTable table = new WoeTable(binSet, Arrays.asList(1d, -1d));
        Assert.assertEquals(table.woeOf(Observation.categorical("a", 0, "c")), 1d);
        Assert.assertEquals(table.woeOf(Observation.categorical("b", 0, "c")), -1d);
        Assert.assertEquals(table.woeOf(Observation.categorical("never-seen", 0, "c")), -1d);
    }

    @Test(expectedExceptions = BinningException.class)
    public void testUnseenCategoryWithoutRareBin() {
        BinSet binSet = BinSet.of(Arrays.asList(new CategoricalBinInfo(Arrays.asList("a")), new CategoricalBinInfo(
                Arrays.asList("b"))));
        new WoeTable(binSet, Arrays.asList(1d, -1d)).woeOf(Observation.categorical("x", 0, "c"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSizeMismatch() {
        new WoeTable(BinSet.fromThresholds(Arrays.asList(1d)), Arrays.asList(1d));
    }
}
