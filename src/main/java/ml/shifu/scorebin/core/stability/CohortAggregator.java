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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import ml.shifu.scorebin.container.obj.Observation;
import ml.shifu.scorebin.core.binning.obj.BinSet;
import ml.shifu.scorebin.exception.EmptyCohortException;
import ml.shifu.scorebin.exception.InsufficientDataException;

import org.apache.commons.collections.CollectionUtils;

/**
 * Groups observations by (bin, cohort) into a {@link CohortTable}.
 */
public final class CohortAggregator {

    private CohortAggregator() {
    }

    /**
     * Aggregate observations without requiring cohort variation.
     *
     * @see #aggregate(BinSet, List, boolean)
     */
    public static CohortTable aggregate(BinSet binSet, List<Observation> observations) {
        return aggregate(binSet, observations, false);
    }

    /**
     * Tally counts and events of each (bin, cohort) pair. Cohorts are all distinct cohort ids of the observations in
     * natural order; a bin without observation in some cohort gets a zero cell instead of being skipped.
     *
     * @param binSet
     *            current bins
     * @param observations
     *            labeled observations, not changed
     * @param requireStability
     *            if at least two distinct cohorts are required
     * @return the aggregated table
     * @throws InsufficientDataException
     *             if there is no observation
     * @throws EmptyCohortException
     *             if stability is required but less than two cohorts are observed
     */
    public static CohortTable aggregate(BinSet binSet, List<Observation> observations, boolean requireStability) {
        if(CollectionUtils.isEmpty(observations)) {
            throw new InsufficientDataException("No observation to aggregate.");
        }

        TreeSet<String> distinctCohorts = new TreeSet<String>();
        for(Observation observation: observations) {
            distinctCohorts.add(observation.getCohortId());
        }
        if(requireStability && distinctCohorts.size() < 2) {
            throw new EmptyCohortException("Stability checking needs at least 2 distinct cohorts, but only "
                    + distinctCohorts + " is found.");
        }

        List<String> cohortIds = new ArrayList<String>(distinctCohorts);
        int cohortCount = cohortIds.size();
        long[] counts = new long[binSet.size() * cohortCount];
        long[] events = new long[binSet.size() * cohortCount];
        for(Observation observation: observations) {
            int cohort = Collections.binarySearch(cohortIds, observation.getCohortId());
            int offset = binSet.indexOf(observation) * cohortCount + cohort;
            counts[offset]++;
            if(observation.isEvent()) {
                events[offset]++;
            }
        }

        return new CohortTable(binSet.size(), cohortIds, counts, events);
    }
}
