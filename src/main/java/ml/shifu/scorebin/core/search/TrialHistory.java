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
import java.util.concurrent.locks.ReentrantLock;

import ml.shifu.scorebin.core.BinningResult;
import ml.shifu.scorebin.exception.BinningErrorCode;

/**
 * Append-only list of trials shared by concurrent evaluations. Trials are numbered in append order under one lock;
 * readers only get snapshots.
 */
public class TrialHistory {

    private final ReentrantLock lock = new ReentrantLock();

    private final List<SearchTrial> trials = new ArrayList<SearchTrial>();

    SearchTrial addComplete(HyperParams params, BinningResult result) {
        lock.lock();
        try {
            SearchTrial trial = SearchTrial.complete(trials.size(), params, result);
            trials.add(trial);
            return trial;
        } finally {
            lock.unlock();
        }
    }

    SearchTrial addFailed(HyperParams params, BinningErrorCode error, String message) {
        lock.lock();
        try {
            SearchTrial trial = SearchTrial.failed(trials.size(), params, error, message);
            trials.add(trial);
            return trial;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return copy of trials so far, in number order
     */
    public List<SearchTrial> getTrials() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<SearchTrial>(trials));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return trials.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return completed trial of the highest score, the lowest number on ties; null if no trial completed
     */
    public SearchTrial getBestTrial() {
        SearchTrial best = null;
        for(SearchTrial trial: getTrials()) {
            if(trial.isComplete() && (best == null || trial.getScore() > best.getScore())) {
                best = trial;
            }
        }
        return best;
    }
}
