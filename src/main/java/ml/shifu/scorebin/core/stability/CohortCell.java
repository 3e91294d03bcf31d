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
package ml.shifu.scorebin.core.stability;

/**
 * Count and event tally of one (bin, cohort) pair.
 */
public final class CohortCell {

    private final int binIndex;
    private final int cohortIndex;
    private final String cohortId;
    private final long count;
    private final long eventCount;

    public CohortCell(int binIndex, int cohortIndex, String cohortId, long count, long eventCount) {
        this.binIndex = binIndex;
        this.cohortIndex = cohortIndex;
        this.cohortId = cohortId;
        this.count = count;
        this.eventCount = eventCount;
    }

    public int getBinIndex() {
        return binIndex;
    }

    public int getCohortIndex() {
        return cohortIndex;
    }

    public String getCohortId() {
        return cohortId;
    }

    public long getCount() {
        return count;
    }

    public long getEventCount() {
        return eventCount;
    }

    public long getNonEventCount() {
        return count - eventCount;
    }

    public boolean isRateDefined() {
        return count > 0;
    }

    /**
     * @return event rate, NaN if the cell has no observation
     */
    public double getEventRate() {
        return count == 0 ? Double.NaN : ((double) eventCount) / count;
    }

    @Override
    public String toString() {
        return "CohortCell [bin=" + binIndex + ", cohort=" + cohortId + ", count=" + count + ", events=" + eventCount
                + "]";
    }
}
