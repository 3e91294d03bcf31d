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
package ml.shifu.scorebin.util;

/**
 * Constants in scorebin.
 */
public interface Constants {

    public static final String version = "0.1.0";

    public static final String BINNING_CONFIG_JSON_FILE_NAME = "BinningConfig.json";

    public static final String SEARCH_SPACE_JSON_FILE_NAME = "SearchSpace.json";

    /**
     * Thread pool size to run search trials
     */
    public static final String SCOREBIN_SEARCH_PARALLEL = "scorebin.search.parallel";

    /**
     * Max number of flatten grid search params, over it a fixed sub-sample is used
     */
    public static final String SCOREBIN_GRIDSEARCH_THRESHOLD = "scorebin.gridsearch.threshold";

    /**
     * Pre-bin number used by dynamic binning before merging
     */
    public static final String SCOREBIN_PREBIN_COUNT = "scorebin.prebin.count";

    public static final int DEFAULT_SEARCH_PARALLEL = 1;

    public static final int DEFAULT_GRIDSEARCH_THRESHOLD = 30;

    public static final int DEFAULT_PREBIN_COUNT = 20;

    /**
     * Floor used for population/event shares before taking logarithms
     */
    public static final double DEFAULT_EPSILON = 1e-4;

    /**
     * Score assigned to a trial which failed on a binning constraint
     */
    public static final double FAILED_TRIAL_SCORE = -1.0E9;

    /**
     * Event rate gaps within this tolerance of minEventRateDiff count as meeting it
     */
    public static final double RATE_DIFF_TOLERANCE = 1e-12;

    public static final String RARE_CATEGORY = "_RARE_";

    public static final String MAX_BINS = "maxBins";
    public static final String MIN_BIN_SIZE = "minBinSize";
    public static final String MIN_EVENT_RATE_DIFF = "minEventRateDiff";

}
