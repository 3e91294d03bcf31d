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

import ml.shifu.scorebin.ObservationFixture;
import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.MonotonicDirection;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.EqualIntervalBinning;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.exception.EmptyCohortException;
import ml.shifu.scorebin.exception.UnsatisfiableConstraintException;
import ml.shifu.scorebin.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ScoreBinnerTest {

    private static final BinningConfig INCREASING = BinningConfig.builder().monotonic(MonotonicDirection.INCREASING)
            .minEventRateDiff(0.03d).build();

    @Test
    public void testFitIncreasingRisk() {
        List<Observation> observations = ObservationFixture.increasingRisk(3000, 11L, "201801", "201802", "201803");
        BinningResult result = ScoreBinner.fit(observations, INCREASING);

        int size = result.getBinSet().size();
        Assert.assertTrue(size >= 2 && size <= INCREASING.getMaxBins(), "unexpected bins " + result.getBinSet());
        double[] rates = result.getCohortTable().getBinEventRates();
        for(int i = 0; i < rates.length - 1; i++) {
            Assert.assertTrue(rates[i + 1] - rates[i] >= 0.03d - Constants.RATE_DIFF_TOLERANCE);
        }

        Assert.assertTrue(result.getIv() > 0d);
        Assert.assertTrue(result.getKs() > 0d && result.getKs() <= 1d);
        Assert.assertEquals(result.getWoeTable().getWoes().size(), size);
        for(int i = 0; i < size - 1; i++) {
            Assert.assertTrue(result.getWoeTable().getWoe(i) < result.getWoeTable().getWoe(i + 1));
        }
        Assert.assertEquals(result.getStabilityMetrics().getCohortIds().size(), 3);
        Assert.assertFalse(Double.isNaN(result.getScore()));
        Assert.assertFalse(result.isDegenerate());
    }

    @Test
    public void testCohortRelabelKeepsResult() {
        List<Observation> observations = ObservationFixture.increasingRisk(2000, 7L, "201801", "201802");
        List<Observation> relabeled = new ArrayList<Observation>();
        for(Observation observation: observations) {
            relabeled.add(Observation.numeric(observation.getNumericValue(), observation.getLabel(), "m"
                    + observation.getCohortId()));
        }

        BinningResult result = ScoreBinner.fit(observations, INCREASING);
        BinningResult other = ScoreBinner.fit(relabeled, INCREASING);
        Assert.assertEquals(other.getBinSet(), result.getBinSet());
        Assert.assertEquals(other.getScore(), result.getScore(), 1e-12);
    }

    @Test
    public void testCustomSplitter() {
        List<Observation> observations = ObservationFixture.increasingRisk(2000, 3L, "201801", "201802");
        BinningConfig config = INCREASING.toBuilder().maxBins(4).build();
        BinningResult result = ScoreBinner.fit(observations, config, new EqualIntervalBinning());
        Assert.assertTrue(result.getBinSet().size() <= 4);
        // refinement only removes thresholds
        Assert.assertTrue(new EqualIntervalBinning().split(observations, config).getThresholds()
                .containsAll(result.getBinSet().getThresholds()));
    }

    @Test
    public void testCategoricalFeature() {
        List<Observation> observations = new ArrayList<Observation>();
        for(String cohort: new String[] { "201801", "201802" }) {
            ObservationFixture.addCategorical(observations, "low", cohort, 200, 10);
            ObservationFixture.addCategorical(observations, "mid", cohort, 200, 40);
            ObservationFixture.addCategorical(observations, "high", cohort, 200, 90);
        }
        BinningResult result = ScoreBinner.fit(observations, BinningConfig.DEFAULT);
        Assert.assertTrue(result.getBinSet().isCategorical());
        Assert.assertEquals(result.getBinSet().size(), 3);
        Assert.assertEquals(result.getBinSet().indexOf(Observation.categorical("high", 1, "201801")), 2);
        Assert.assertTrue(result.getWoeTable().woeOf(Observation.categorical("low", 0, "201803")) < 0d);
    }

    @Test(expectedExceptions = EmptyCohortException.class)
    public void testSingleCohort() {
        ScoreBinner.fit(ObservationFixture.increasingRisk(500, 3L, "201801"), INCREASING);
    }

    @Test
    public void testSingleCohortWithoutStability() {
        BinningResult result = ScoreBinner.fit(ObservationFixture.increasingRisk(500, 3L, "201801"), INCREASING
                .toBuilder().checkStability(false).build());
        Assert.assertFalse(result.getStabilityMetrics().isStabilityChecked());
        Assert.assertTrue(result.getIv() >= 0d);
    }

    @Test(expectedExceptions = UnsatisfiableConstraintException.class)
    public void testBinSizeOverPopulation() {
        ScoreBinner.fit(ObservationFixture.increasingRisk(500, 3L, "201801", "201802"), INCREASING.toBuilder()
                .minBinSize(1.5d).build());
    }

    @Test
    public void testMixedFeatureType() {
        List<Observation> observations = ObservationFixture.increasingRisk(10, 3L, "201801", "201802");
        observations.add(Observation.categorical("a", 1, "201801"));
        try {
            ScoreBinner.fit(observations, BinningConfig.DEFAULT);
            Assert.fail("mixed observations should be rejected");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_MIXED_FEATURE_TYPE);
        }
    }
}
