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
 * Outcome of {@link BinningOptimizer#optimize(int)}.
 */
public final class SearchResult {

    /**
     * Best completed trial, null if every trial failed or none ran.
     */
    private final SearchTrial bestTrial;

    private final List<SearchTrial> trials;

    /**
     * If the time budget ran out before all proposals were evaluated.
     */
    private final boolean cancelled;

    private final int skippedTrials;

    private final long elapsedMillis;

    SearchResult(SearchTrial bestTrial, List<SearchTrial> trials, boolean cancelled, int skippedTrials,
            long elapsedMillis) {
        this.bestTrial = bestTrial;
        this.trials = trials;
        this.cancelled = cancelled;
        this.skippedTrials = skippedTrials;
        this.elapsedMillis = elapsedMillis;
    }

    public SearchTrial getBestTrial() {
        return bestTrial;
    }

    public boolean hasCompletedTrial() {
        return bestTrial != null;
    }

    public HyperParams getBestParams() {
        return bestTrial == null ? null : bestTrial.getParams();
    }

    public List<SearchTrial> getTrials() {
        return trials;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public int getSkippedTrials() {
        return skippedTrials;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "SearchResult [best=" + bestTrial + ", trials=" + trials.size() + ", cancelled=" + cancelled
                + ", skipped=" + skippedTrials + ", elapsed=" + elapsedMillis + "ms]";
    }
}
