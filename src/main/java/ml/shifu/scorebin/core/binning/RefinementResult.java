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
package ml.shifu.scorebin.core.binning;

import java.util.Collections;
import java.util.List;

import ml.shifu.scorebin.container.obj.MonotonicDirection;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.core.stability.CohortTable;

/**
 * Terminal state of one refinement run.
 */
public final class RefinementResult {

    private final BinSet binSet;

    private final CohortTable cohortTable;

    /**
     * Direction enforced, never {@link MonotonicDirection#AUTO}.
     */
    private final MonotonicDirection direction;

    private final List<MergeStep> mergeSteps;

    public RefinementResult(BinSet binSet, CohortTable cohortTable, MonotonicDirection direction,
            List<MergeStep> mergeSteps) {
        this.binSet = binSet;
        this.cohortTable = cohortTable;
        this.direction = direction;
        this.mergeSteps = Collections.unmodifiableList(mergeSteps);
    }

    public BinSet getBinSet() {
        return binSet;
    }

    public CohortTable getCohortTable() {
        return cohortTable;
    }

    public MonotonicDirection getDirection() {
        return direction;
    }

    public List<MergeStep> getMergeSteps() {
        return mergeSteps;
    }

    /**
     * @return if everything was merged into a single bin, the feature has no usable signal
     */
    public boolean isDegenerate() {
        return binSet.size() == 1;
    }
}
