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

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.scorebin.ObservationFixture;
import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.MonotonicDirection;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.BinningResult;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class BinningOptimizerTest {

    private static final List<Observation> OBSERVATIONS = ObservationFixture.increasingRisk(2000, 13L, "201801",
            "201802", "201803");

    private static final BinningConfig BASE = BinningConfig.builder().monotonic(MonotonicDirection.INCREASING)
            .build();

    private static GridSearch grid(Object minBinSize) {
        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.MAX_BINS, Arrays.<Object> asList(3, 5));
        params.put(Constants.MIN_BIN_SIZE, minBinSize);
        params.put(Constants.MIN_EVENT_RATE_DIFF, Arrays.<Object> asList(0.02d, 0.05d));
        return new GridSearch(params);
    }

    @Test
    public void testParallelGridSearch() {
        BinningObjective objective = new BinningObjective(OBSERVATIONS, BASE);
        SearchResult result = new BinningOptimizer(objective, grid(0.05d), 0L, 2).optimize(10);

        Assert.assertEquals(result.getTrials().size(), 4);
        Assert.assertFalse(result.isCancelled());
        Assert.assertEquals(result.getSkippedTrials(), 0);
        Assert.assertTrue(result.hasCompletedTrial());
        for(SearchTrial trial: result.getTrials()) {
            Assert.assertTrue(trial.getScore() <= result.getBestTrial().getScore());
        }

        BinningResult best = new BinningOptimizer(objective, grid(0.05d)).refitBest(result);
        Assert.assertEquals(best.getScore(), result.getBestTrial().getScore(), 1e-12);
        Assert.assertEquals(best.getBinSet(), result.getBestTrial().getBinSet());
    }

    @Test
    public void testSecondRunReportsOwnTrials() {
        BinningObjective objective = new BinningObjective(OBSERVATIONS, BASE);
        SearchResult first = new BinningOptimizer(objective, grid(0.05d), 0L, 2).optimize(0);
        Assert.assertTrue(first.hasCompletedTrial());

        SearchResult second = new BinningOptimizer(objective, grid(1.5d), 0L, 2).optimize(0);
        Assert.assertEquals(second.getTrials().size(), 4);
        for(SearchTrial trial: second.getTrials()) {
            Assert.assertTrue(trial.getNumber() >= 4);
        }
        Assert.assertFalse(second.hasCompletedTrial());
        Assert.assertEquals(objective.getHistory().size(), 8);
    }

    @Test
    public void testAllTrialsFailed() {
        BinningObjective objective = new BinningObjective(OBSERVATIONS, BASE);
        BinningOptimizer optimizer = new BinningOptimizer(objective, grid(1.5d), 0L, 2);
        SearchResult result = optimizer.optimize(0);

        Assert.assertEquals(result.getTrials().size(), 4);
        Assert.assertFalse(result.hasCompletedTrial());
        Assert.assertNull(result.getBestParams());
        try {
            optimizer.refitBest(result);
            Assert.fail("nothing to refit");
        } catch (BinningException e) {
            Assert.assertEquals(e.getError(), BinningErrorCode.ERROR_SEARCH_EXECUTION);
        }
    }

    @Test
    public void testTimeBudget() {
        BinningObjective slow = new BinningObjective(OBSERVATIONS, BASE) {
            @Override
            public SearchTrial evaluateTrial(HyperParams params) {
                try {
                    Thread.sleep(200L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.evaluateTrial(params);
            }
        };
        SearchResult result = new BinningOptimizer(slow, new RandomSearch(SearchSpace.DEFAULT, 3L), 300L, 1)
                .optimize(6);

        Assert.assertTrue(result.isCancelled());
        Assert.assertTrue(result.getTrials().size() >= 1);
        Assert.assertEquals(result.getSkippedTrials() + result.getTrials().size(), 6);
    }
}
