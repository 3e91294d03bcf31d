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
package ml.shifu.scorebin.container.obj;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import org.apache.commons.lang.StringUtils;

/**
 * One labeled, time-stamped input row. Immutable, so it can be shared read-only by concurrent search trials.
 *
 * <p>
 * Cohort ids are compared by natural string order, which must be the temporal order (e.g. yyyyMM).
 */
public final class Observation {

    private final double numericValue;

    private final String categoricalValue;

    private final int label;

    private final String cohortId;

    private Observation(double numericValue, String categoricalValue, int label, String cohortId) {
        if(label != 0 && label != 1) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_OBSERVATION, "Invalid label " + label
                    + ", label must be 1 or 0.");
        }
        if(StringUtils.isBlank(cohortId)) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_OBSERVATION, "Cohort id must not be blank.");
        }
        this.numericValue = numericValue;
        this.categoricalValue = categoricalValue;
        this.label = label;
        this.cohortId = cohortId;
    }

    public static Observation numeric(double value, int label, String cohortId) {
        if(Double.isNaN(value) || Double.isInfinite(value)) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_OBSERVATION, "Numeric feature value " + value
                    + " is not finite.");
        }
        return new Observation(value, null, label, cohortId);
    }

    public static Observation categorical(String value, int label, String cohortId) {
        if(value == null) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_OBSERVATION,
                    "Categorical feature value must not be null.");
        }
        return new Observation(Double.NaN, value, label, cohortId);
    }

    public boolean isCategorical() {
        return categoricalValue != null;
    }

    public double getNumericValue() {
        return numericValue;
    }

    public String getCategoricalValue() {
        return categoricalValue;
    }

    public int getLabel() {
        return label;
    }

    public boolean isEvent() {
        return label == 1;
    }

    public String getCohortId() {
        return cohortId;
    }

    @Override
    public String toString() {
        return "Observation [" + (isCategorical() ? categoricalValue : Double.toString(numericValue)) + ", label="
                + label + ", cohort=" + cohortId + "]";
    }

}
