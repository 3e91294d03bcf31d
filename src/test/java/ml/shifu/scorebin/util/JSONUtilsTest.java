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
package ml.shifu.scorebin.util;

import java.io.InputStream;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.MonotonicDirection;
import ml.shifu.scorebin.container.obj.PsiAggregation;
import ml.shifu.scorebin.core.search.SearchSpace;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.apache.commons.io.IOUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

public class JSONUtilsTest {

    @Test
    public void testLoadBinningConfig() {
        InputStream is = getClass().getResourceAsStream("/config/" + Constants.BINNING_CONFIG_JSON_FILE_NAME);
        try {
            BinningConfig config = JSONUtils.loadBinningConfig(is);
            Assert.assertEquals(config.getMonotonic(), MonotonicDirection.INCREASING);
            Assert.assertEquals(config.getMinEventRateDiff(), 0.03d);
            Assert.assertEquals(config.getMinBinSize(), 0.1d);
            Assert.assertEquals(config.getMaxBins(), 5);
            Assert.assertEquals(config.getMinBins(), 2);
            Assert.assertEquals(config.getWeights().getSeparability(), 0.6d);
            Assert.assertEquals(config.getWeights().getPsi(), 0.5d);
            Assert.assertEquals(config.getReferenceCohort(), "201801");
            Assert.assertEquals(config.getEpsilon(), 0.001d);
            Assert.assertEquals(config.getPsiAggregation(), PsiAggregation.MAX);
            Assert.assertTrue(config.isPenalizeInversions());
            // not in file
            Assert.assertFalse(config.isPenalizeLowFrequency());
            Assert.assertEquals(config.getRareThreshold(), 0.01d);
        } finally {
            IOUtils.closeQuietly(is);
        }
    }

    @Test
    public void testLoadSearchSpace() {
        InputStream is = getClass().getResourceAsStream("/config/" + Constants.SEARCH_SPACE_JSON_FILE_NAME);
        try {
            SearchSpace space = JSONUtils.loadSearchSpace(is);
            Assert.assertEquals(space.getMaxBinsLow(), 3);
            Assert.assertEquals(space.getMaxBinsHigh(), 6);
            Assert.assertEquals(space.getMinBinSizeLow(), 0.02d);
            Assert.assertEquals(space.getMinEventRateDiffHigh(), 0.1d);
            Assert.assertEquals(space.getGridSize(), 3);
        } finally {
            IOUtils.closeQuietly(is);
        }
    }

    @Test
    public void testMalformedJson() throws Exception {
        try {
            JSONUtils.loadBinningConfig(IOUtils.toInputStream("{ \"maxBins\" : ", "UTF-8"));
            Assert.fail("malformed json should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_LOAD_BINNING_CONFIG);
        }
    }

    @Test
    public void testInvalidValues() throws Exception {
        try {
            JSONUtils.loadBinningConfig(IOUtils.toInputStream("{ \"epsilon\" : 2.0 }", "UTF-8"));
            Assert.fail("epsilon out of range should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_INVALID_BINNING_CONFIG);
        }
        try {
            JSONUtils.loadSearchSpace(IOUtils.toInputStream("{ \"maxBinsLow\" : 8, \"maxBinsHigh\" : 4 }", "UTF-8"));
            Assert.fail("inverted range should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_GRID_SEARCH_CONFIG);
        }
    }

    @Test
    public void testUnknownDirection() throws Exception {
        try {
            JSONUtils.loadBinningConfig(IOUtils.toInputStream("{ \"monotonic\" : \"SIDEWAYS\" }", "UTF-8"));
            Assert.fail("unknown direction should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_LOAD_BINNING_CONFIG);
        }
    }
}
