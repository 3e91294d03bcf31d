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

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.BinningResult;
import ml.shifu.scorebin.core.ScoreBinner;
import ml.shifu.scorebin.core.binning.InitialSplitter;
import ml.shifu.scorebin.exception.BinningException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Objective function handed to hyperparameter search. Each {@link #evaluate(HyperParams)} runs a full fit and
 * appends exactly one trial to the {@link TrialHistory}.
 * 
 * <p>
 * A {@link BinningException} in a fit, e.g. unsatisfiable constraints or a single cohort, turns into a failed trial
 * scored {@link ml.shifu.scorebin.util.Constants#FAILED_TRIAL_SCORE}, so one bad vector never stops the search.
 * Safe to call from concurrent threads.
 */
public class BinningObjective {

    private static final Logger LOG = LoggerFactory.getLogger(BinningObjective.class);

    private final List<Observation> observations;

    private final BinningConfig baseConfig;

    private final InitialSplitter splitter;

    private final TrialHistory history;

    public BinningObjective(List<Observation> observations, BinningConfig baseConfig) {
        this(observations, baseConfig, null);
    }

    /**
     * @param observations
     *            observations of one feature, shared read-only by all trials
     * @param baseConfig
     *            config fields not searched
     * @param splitter
     *            initial splitter, null for the default one of the feature kind
     */
    public BinningObjective(List<Observation> observations, BinningConfig baseConfig, InitialSplitter splitter) {
        this.observations = Collections.unmodifiableList(new ArrayList<Observation>(observations));
        this.baseConfig = baseConfig;
        this.splitter = splitter;
        this.history = new TrialHistory();
    }

    /**
     * @return score of the params, {@link ml.shifu.scorebin.util.Constants#FAILED_TRIAL_SCORE} if they can not be
     *         fitted
     */
    public double evaluate(HyperParams params) {
        return evaluateTrial(params).getScore();
    }

    public SearchTrial evaluateTrial(HyperParams params) {
        try {
            BinningResult result = ScoreBinner.fit(observations, params.applyTo(baseConfig), splitter);
            SearchTrial trial = history.addComplete(params, result);
            LOG.debug("Trial {} completed with score {}.", trial.getNumber(), trial.getScore());
            return trial;
        } catch (BinningException e) {
            SearchTrial trial = history.addFailed(params, e.getError(), e.getMessage());
            LOG.warn("Trial {} with {} failed: {} {}", trial.getNumber(), params, e.getError(), e.getMessage());
            return trial;
        }
    }

    /**
     * Fit the params again to get the full result, e.g. the WoE table of the best trial.
     */
    public BinningResult refit(HyperParams params) {
        return ScoreBinner.fit(observations, params.applyTo(baseConfig), splitter);
    }

    public TrialHistory getHistory() {
        return history;
    }

    public BinningConfig getBaseConfig() {
        return baseConfig;
    }
}
