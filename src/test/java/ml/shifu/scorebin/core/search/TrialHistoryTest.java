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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import ml.shifu.scorebin.ObservationFixture;
import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.executor.ExecutorManager;

import org.testng.Assert;
import org.testng.annotations.Test;

public class TrialHistoryTest {

    @Test
    public void testBestTrialIgnoresFailures() {
        TrialHistory history = new TrialHistory();
        Assert.assertNull(history.getBestTrial());
        history.addFailed(new HyperParams(3, 0.05d, 0.02d), BinningErrorCode.ERROR_EMPTY_COHORT, "single cohort");
        Assert.assertNull(history.getBestTrial());
        Assert.assertEquals(history.size(), 1);
    }

    @Test
    public void testSnapshotIsNotLive() {
        TrialHistory history = new TrialHistory();
        List<SearchTrial> snapshot = history.getTrials();
        history.addFailed(new HyperParams(3, 0.05d, 0.02d), BinningErrorCode.ERROR_EMPTY_COHORT, "single cohort");
        Assert.assertTrue(snapshot.isEmpty());
        try {
            history.getTrials().clear();
            Assert.fail("snapshot should be read only");
        } catch (UnsupportedOperationException e) {
            Assert.assertEquals(history.size(), 1);
        }
    }

    @Test
    public void testConcurrentNumbering() {
        final BinningObjective objective = new BinningObjective(ObservationFixture.increasingRisk(1000, 9L, "a",
                "b"), BinningConfig.DEFAULT);
        List<Callable<SearchTrial>> tasks = new ArrayList<Callable<SearchTrial>>();
        for(int i = 0; i < 8; i++) {
            final HyperParams params = new HyperParams(3 + i % 4, i < 4 ? 0.05d : 2d, 0.02d);
            tasks.add(new Callable<SearchTrial>() {
                @Override
                public SearchTrial call() {
                    return objective.evaluateTrial(params);
                }
            });
        }

        ExecutorManager<SearchTrial> manager = new ExecutorManager<SearchTrial>(4);
        try {
            manager.submitTasksAndWaitResults(tasks);
        } finally {
            manager.graceShutDown();
        }

        List<SearchTrial> trials = objective.getHistory().getTrials();
        Assert.assertEquals(trials.size(), 8);
        Set<Integer> numbers = new HashSet<Integer>();
        int failed = 0;
        for(int i = 0; i < trials.size(); i++) {
            Assert.assertEquals(trials.get(i).getNumber(), i);
            numbers.add(trials.get(i).getNumber());
            if(!trials.get(i).isComplete()) {
                failed++;
            }
        }
        Assert.assertEquals(numbers.size(), 8);
        Assert.assertEquals(failed, 4);
        Assert.assertTrue(objective.getHistory().getBestTrial().isComplete());
    }
}
