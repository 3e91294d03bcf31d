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

import java.util.List;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.ColumnStatsCalculator.ColumnMetrics;
import ml.shifu.scorebin.core.binning.CategoricalBinning;
import ml.shifu.scorebin.core.binning.DynamicBinning;
import ml.shifu.scorebin.core.binning.InitialSplitter;
import ml.shifu.scorebin.core.binning.MonotonicRefiner;
import ml.shifu.scorebin.core.binning.RefinementResult;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.stability.CohortAggregator;
import ml.shifu.scorebin.core.stability.CohortTable;
import ml.shifu.scorebin.core.stability.StabilityMetrics;
import ml.shifu.scorebin.core.stability.StabilityScorer;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.exception.InsufficientDataException;

import org.apache.commons.collections.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits bins of one feature: initial split, monotonic refinement, stability scoring and objective composing.
 * 
 * <p>
 * All errors propagate with their own {@link BinningErrorCode}, use
 * {@link ml.shifu.scorebin.core.search.BinningObjective} to turn them into failed search trials instead.
 */
public final class ScoreBinner {

    private static final Logger LOG = LoggerFactory.getLogger(ScoreBinner.class);

    private ScoreBinner() {
    }

    /**
     * Fit with the default splitter of the feature kind, {@link DynamicBinning} for numerical and
     * {@link CategoricalBinning} for categorical observations.
     */
    public static BinningResult fit(List<Observation> observations, BinningConfig config) {
        return fit(observations, config, null);
    }

    /**
     * @param observations
     *            observations of a single feature
     * @param config
     *            binning config
     * @param splitter
     *            initial splitter, null for the default one
     * @return fitted bins with metrics
     */
    public static BinningResult fit(List<Observation> observations, BinningConfig config, InitialSplitter splitter) {
        boolean categorical = checkFeatureType(observations);
        InitialSplitter initialSplitter = splitter == null ? defaultSplitter(categorical) : splitter;

        BinSet initial = initialSplitter.split(observations, config);
        // fail fast on a single cohort before refining
        CohortAggregator.aggregate(initial, observations, config.isCheckStability());

        RefinementResult refinement = MonotonicRefiner.refine(initial, observations, config);
        CohortTable table = refinement.getCohortTable();

        StabilityMetrics stability = StabilityScorer.score(table, config);
        ColumnMetrics column = ColumnStatsCalculator.calculateColumnMetrics(table.getBinNonEvents(),
                table.getBinEvents(), config.getEpsilon());
        double score = ObjectiveComposer.compose(stability, column, config);

        WoeTable woeTable = new WoeTable(refinement.getBinSet(), column.getBinningWoe());
        LOG.info("Fitted {} bins from {} initial bins with {} merges, iv {}, ks {}, separability {}, score {}.",
                refinement.getBinSet().size(), initial.size(), refinement.getMergeSteps().size(), column.getIv(),
                column.getKs(), stability.getSeparability(), score);
        return new BinningResult(config, refinement, stability, column.getIv(), column.getKs(), woeTable, score,
                column.getSubstitutions());
    }

    public static InitialSplitter defaultSplitter(boolean categorical) {
        return categorical ? new CategoricalBinning() : new DynamicBinning();
    }

    /**
     * @return if observations are categorical
     */
    private static boolean checkFeatureType(List<Observation> observations) {
        if(CollectionUtils.isEmpty(observations)) {
            throw new InsufficientDataException("No observation to fit.");
        }
        boolean categorical = observations.get(0).isCategorical();
        for(Observation observation: observations) {
            if(observation.isCategorical() != categorical) {
                throw new BinningException(BinningErrorCode.ERROR_MIXED_FEATURE_TYPE,
                        "Numerical and categorical observations are mixed in one feature.");
            }
        }
        return categorical;
    }
}
