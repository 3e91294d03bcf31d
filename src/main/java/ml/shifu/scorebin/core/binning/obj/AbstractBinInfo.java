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
package ml.shifu.scorebin.core.binning.obj;

/**
 * Definition of one bin. Bins only carry their boundary (interval or category group); counts and event rates are
 * always derived from observations by the cohort aggregator.
 */
public abstract class AbstractBinInfo {

    /**
     * Merge the right neighbour into a new bin, this bin is not changed.
     *
     * @param next
     *            the bin on the right side
     * @return the merged bin
     */
    public abstract AbstractBinInfo mergeRight(AbstractBinInfo next);

    /**
     * @return readable boundary used in logs and trial reports
     */
    public abstract String getLabel();

    public abstract boolean isCategorical();

    @Override
    public String toString() {
        return getLabel();
    }
}
