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

/**
 * Required direction of event rates across ordered bins.
 */
public enum MonotonicDirection {
    /**
     * Event rate non-decreasing with bin ordinal.
     */
    INCREASING,
    /**
     * Event rate non-increasing with bin ordinal.
     */
    DECREASING,
    /**
     * Resolved to {@link #INCREASING} or {@link #DECREASING} from the sign of the ordinal/event-rate covariance on
     * the initial bins.
     */
    AUTO,
    /**
     * No monotonicity constraint, only the minimum gap and minimum size are enforced.
     */
    NONE;

    /**
     * @param previous
     *            event rate of the left bin
     * @param next
     *            event rate of the right bin
     * @return true if the pair breaks this direction, {@link #AUTO} must be resolved before calling this
     */
    public boolean isViolatedBy(double previous, double next) {
        switch(this) {
            case INCREASING:
                return next < previous;
            case DECREASING:
                return next > previous;
            case NONE:
                return false;
            default:
                throw new IllegalStateException("Direction " + this + " should be resolved before checking.");
        }
    }
}
