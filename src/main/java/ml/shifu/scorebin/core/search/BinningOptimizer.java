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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import ml.shifu.scorebin.core.BinningResult;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.executor.ExecutorManager;
import ml.shifu.scorebin.util.Constants;
import ml.shifu.scorebin.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a search: proposals from a {@link HyperParamSampler} are evaluated by a {@link BinningObjective} on a pool
 * of {@code scorebin.search.parallel} threads.
 * 
 * <p>
 * The time budget is checked when a trial is about to start; a running fit is never interrupted. Each
 * {@link #optimize(int)} call reports only the trials it ran, even when the objective is reused.
 */
public class BinningOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(BinningOptimizer.class);

    private final BinningObjective objective;

    private final HyperParamSampler sampler;

    private final int parallel;

    /**
     * Time budget in milliseconds, non-positive for no limit.
     */
    private final long timeBudgetMillis;

    public BinningOptimizer(BinningObjective objective, HyperParamSampler sampler) {
        this(objective, sampler, 0L);
    }

    public BinningOptimizer(BinningObjective objective, HyperParamSampler sampler, long timeBudgetMillis) {
        this(objective, sampler, timeBudgetMillis, Environment.getInt(Constants.SCOREBIN_SEARCH_PARALLEL,
                Constants.DEFAULT_SEARCH_PARALLEL));
    }

    public BinningOptimizer(BinningObjective objective, HyperParamSampler sampler, long timeBudgetMillis,
            int parallel) {
        this.objective = objective;
        this.sampler = sampler;
        this.timeBudgetMillis = timeBudgetMillis;
        this.parallel = Math.max(1, parallel);
    }

    /**
     * @param nTrials
     *            max number of trials
     * @return best trial and history snapshot
     */
    public SearchResult optimize(int nTrials) {
        final long start = System.currentTimeMillis();
        final long deadline = timeBudgetMillis > 0 ? start + timeBudgetMillis : Long.MAX_VALUE;

        TrialHistory history = objective.getHistory();
        int firstTrial = history.size();

        List<HyperParams> proposals = sampler.propose(nTrials);
        LOG.info("Start search of {} trials with {} threads.", proposals.size(), parallel);

        List<Callable<Boolean>> tasks = new ArrayList<Callable<Boolean>>(proposals.size());
        for(final HyperParams params: proposals) {
            tasks.add(new Callable<Boolean>() {
                @Override
                public Boolean call() {
                    if(System.currentTimeMillis() >= deadline) {
                        return Boolean.FALSE;
                    }
                    objective.evaluateTrial(params);
                    return Boolean.TRUE;
                }
            });
        }

        ExecutorManager<Boolean> manager = new ExecutorManager<Boolean>(parallel);
        List<Boolean> started;
        try {
            started = manager.submitTasksAndWaitResults(tasks);
        } finally {
            manager.forceShutDown();
        }

        int skipped = 0;
        for(Boolean run: started) {
            if(!run) {
                skipped++;
            }
        }
        if(skipped > 0) {
            LOG.warn("Time budget {}ms ran out, {} of {} trials are skipped.", timeBudgetMillis, skipped,
                    proposals.size());
        }

        // trials of earlier runs on the same objective are not part of this result
        List<SearchTrial> all = history.getTrials();
        List<SearchTrial> trials = Collections.unmodifiableList(new ArrayList<SearchTrial>(all.subList(firstTrial,
                all.size())));
        SearchTrial best = null;
        for(SearchTrial trial: trials) {
            if(trial.isComplete() && (best == null || trial.getScore() > best.getScore())) {
                best = trial;
            }
        }
        long elapsed = System.currentTimeMillis() - start;
        if(best == null) {
            LOG.warn("No trial completed in {} trials.", trials.size());
        } else {
            LOG.info("Search finished in {}ms, best trial {} with {} scores {}.", elapsed, best.getNumber(),
                    best.getParams(), best.getScore());
        }
        return new SearchResult(best, trials, skipped > 0, skipped, elapsed);
    }

    /**
     * Fit the best params of a search again to get bins, metrics and the WoE table.
     * 
     * @throws BinningException
     *             with {@link BinningErrorCode#ERROR_SEARCH_EXECUTION} if no trial completed
     */
    public BinningResult refitBest(SearchResult result) {
        if(!result.hasCompletedTrial()) {
            throw new BinningException(BinningErrorCode.ERROR_SEARCH_EXECUTION, "No completed trial to refit.");
        }
        return objective.refit(result.getBestParams());
    }
}
