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

import ml.shifu.scorebin.core.BinningResult;
import ml.shifu.scorebin.core.binning.obj.AbstractBinInfo;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.stability.StabilityMetrics;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.util.Constants;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Immutable record of one objective evaluation. Failed trials have no bins nor metrics and score
 * {@link Constants#FAILED_TRIAL_SCORE}.
 */
public final class SearchTrial {

    public static enum TrialState {
        COMPLETE, FAILED
    }

    private final int number;

    private final HyperParams params;

    private final BinSet binSet;

    private final StabilityMetrics stabilityMetrics;

    private final double iv;

    private final double ks;

    private final double score;

    private final TrialState state;

    private final BinningErrorCode error;

    private final String message;

    private SearchTrial(int number, HyperParams params, BinSet binSet, StabilityMetrics stabilityMetrics, double iv,
            double ks, double score, TrialState state, BinningErrorCode error, String message) {
        this.number = number;
        this.params = params;
        this.binSet = binSet;
        this.stabilityMetrics = stabilityMetrics;
        this.iv = iv;
        this.ks = ks;
        this.score = score;
        this.state = state;
        this.error = error;
        this.message = message;
    }

    static SearchTrial complete(int number, HyperParams params, BinningResult result) {
        return new SearchTrial(number, params, result.getBinSet(), result.getStabilityMetrics(), result.getIv(),
                result.getKs(), result.getScore(), TrialState.COMPLETE, null, null);
    }

    static SearchTrial failed(int number, HyperParams params, BinningErrorCode error, String message) {
        return new SearchTrial(number, params, null, null, Double.NaN, Double.NaN, Constants.FAILED_TRIAL_SCORE,
                TrialState.FAILED, error, message);
    }

    public int getNumber() {
        return number;
    }

    public HyperParams getParams() {
        return params;
    }

    @JsonIgnore
    public BinSet getBinSet() {
        return binSet;
    }

    @JsonIgnore
    public StabilityMetrics getStabilityMetrics() {
        return stabilityMetrics;
    }

    /**
     * @return bin labels for reporting, empty for failed trials
     */
    public List<String> getBinLabels() {
        if(binSet == null) {
            return Collections.emptyList();
        }
        List<String> labels = new ArrayList<String>(binSet.size());
        for(AbstractBinInfo bin: binSet.getBins()) {
            labels.add(bin.getLabel());
        }
        return labels;
    }

    public double getPsiMean() {
        return stabilityMetrics == null ? Double.NaN : stabilityMetrics.getPsiMean();
    }

    public double getSeparability() {
        return stabilityMetrics == null ? Double.NaN : stabilityMetrics.getSeparability();
    }

    public double getIv() {
        return iv;
    }

    public double getKs() {
        return ks;
    }

    public double getScore() {
        return score;
    }

    public TrialState getState() {
        return state;
    }

    @JsonIgnore
    public boolean isComplete() {
        return state == TrialState.COMPLETE;
    }

    public BinningErrorCode getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "SearchTrial [#" + number + " " + state + ", " + params + ", score=" + score
                + (error == null ? "" : ", error=" + error) + "]";
    }
}
