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
import java.util.Collections;
import java.util.List;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.core.binning.RefinementResult;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.stability.CohortTable;
import ml.shifu.scorebin.core.stability.GuardSubstitution;
import ml.shifu.scorebin.core.stability.StabilityMetrics;

/**
 * Outcome of {@link ScoreBinner#fit}: final bins with their metrics, score and WoE encoding.
 */
public final class BinningResult {

    private final BinningConfig config;

    private final RefinementResult refinement;

    private final StabilityMetrics stabilityMetrics;

    private final double iv;

    private final double ks;

    private final WoeTable woeTable;

    private final double score;

    /**
     * Epsilon floors applied while computing IV and WoE.
     */
    private final List<GuardSubstitution> ivSubstitutions;

    public BinningResult(BinningConfig config, RefinementResult refinement, StabilityMetrics stabilityMetrics,
            double iv, double ks, WoeTable woeTable, double score, List<GuardSubstitution> ivSubstitutions) {
        this.config = config;
        this.refinement = refinement;
        this.stabilityMetrics = stabilityMetrics;
        this.iv = iv;
        this.ks = ks;
        this.woeTable = woeTable;
        this.score = score;
        this.ivSubstitutions = Collections.unmodifiableList(ivSubstitutions);
    }

    public BinningConfig getConfig() {
        return config;
    }

    public BinSet getBinSet() {
        return refinement.getBinSet();
    }

    public CohortTable getCohortTable() {
        return refinement.getCohortTable();
    }

    public RefinementResult getRefinement() {
        return refinement;
    }

    public StabilityMetrics getStabilityMetrics() {
        return stabilityMetrics;
    }

    public double getIv() {
        return iv;
    }

    public double getKs() {
        return ks;
    }

    public WoeTable getWoeTable() {
        return woeTable;
    }

    public double getScore() {
        return score;
    }

    public List<GuardSubstitution> getIvSubstitutions() {
        return ivSubstitutions;
    }

    /**
     * @return every epsilon floor applied in PSI, IV and WoE
     */
    public List<GuardSubstitution> getSubstitutions() {
        List<GuardSubstitution> all = new ArrayList<GuardSubstitution>(stabilityMetrics.getSubstitutions());
        all.addAll(ivSubstitutions);
        return all;
    }

    public boolean isDegenerate() {
        return refinement.isDegenerate();
    }

    @Override
    public String toString() {
        return "BinningResult [bins=" + getBinSet() + ", iv=" + iv + ", ks=" + ks + ", score=" + score + ", "
                + stabilityMetrics + "]";
    }
}
