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
package ml.shifu.scorebin.exception;

/**
 * Scorebin error code
 */
public enum BinningErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_SCOREBIN_CONFIG(400, "Errors happen when loading scorebinconfig"), ERROR_LOAD_BINNING_CONFIG(401,
            "Could not load binning config json"), ERROR_INVALID_BINNING_CONFIG(402,
            "The binning config did not pass the validation"), ERROR_GRID_SEARCH_CONFIG(403,
            "Errors happen when parsing grid search params"),

    /*
     * Input data error: 1151 - 1200
     */
    ERROR_INVALID_OBSERVATION(1151, "Invalid observation, label must be 1 or 0 and cohort id must not be blank"), ERROR_INVALID_PARTITION(
            1152, "The bin set is not a valid exhaustive partition of the observed values"), ERROR_MIXED_FEATURE_TYPE(
            1153, "Numeric and categorical observations can not be binned together"),

    /*
     * Binning error: 2001 - 2050
     */
    ERROR_EMPTY_COHORT(2001, "Stability checking needs at least two distinct cohorts"), ERROR_INSUFFICIENT_DATA(
            2002, "Empty bin or zero population"), ERROR_UNSATISFIABLE_CONSTRAINT(2003,
            "Binning constraints are contradictory and can not be satisfied"), ERROR_REFERENCE_COHORT_NOT_FOUND(2004,
            "The reference cohort is not found in observations"),

    /*
     * Search error: 2101 - 2150
     */
    ERROR_SEARCH_EXECUTION(2101, "Exception happened when executing search trials");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    private BinningErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     *
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     *
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
