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

import java.util.List;

/**
 * Proposal strategy of hyperparameter vectors.
 */
public interface HyperParamSampler {

    /**
     * @param nTrials
     *            max number of vectors wanted
     * @return vectors to evaluate, in evaluation order; may be fewer than asked
     */
    List<HyperParams> propose(int nTrials);
}
