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

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.container.obj.ObjectiveWeights;
import ml.shifu.scorebin.core.ColumnStatsCalculator.ColumnMetrics;
import ml.shifu.scorebin.core.stability.StabilityMetrics;

/**
 * Folds separation and stability metrics into the scalar score maximized by search.
 */
public final class ObjectiveComposer {

    private ObjectiveComposer() {
    }

    /**
     * {@code w_sep * separability + w_iv * iv + w_ks * ks - w_psi * psi}.
     */
    public static double compose(double separability, double iv, double ks, double psi, ObjectiveWeights weights) {
        return weights.getSeparability() * separability + weights.getIv() * iv + weights.getKs() * ks
                - weights.getPsi() * psi;
    }

    /**
     * Compose with weights of the config, PSI is aggregated over cohorts as the config tells.
     */
    public static double compose(StabilityMetrics stability, ColumnMetrics column, BinningConfig config) {
        return compose(stability.getSeparability(), column.getIv(), column.getKs(),
                stability.getPsi(config.getPsiAggregation()), config.getWeights());
    }
}
