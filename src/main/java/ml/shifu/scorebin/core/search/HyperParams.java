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

import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.scorebin.container.obj.BinningConfig;
import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;
import ml.shifu.scorebin.util.Constants;

/**
 * One hyperparameter vector proposed by search: {@code maxBins}, {@code minBinSize} and {@code minEventRateDiff}.
 */
public final class HyperParams {

    private final int maxBins;

    private final double minBinSize;

    private final double minEventRateDiff;

    public HyperParams(int maxBins, double minBinSize, double minEventRateDiff) {
        this.maxBins = maxBins;
        this.minBinSize = minBinSize;
        this.minEventRateDiff = minEventRateDiff;
    }

    /**
     * Build from a flattened grid search parameter map keyed by {@link Constants#MAX_BINS},
     * {@link Constants#MIN_BIN_SIZE} and {@link Constants#MIN_EVENT_RATE_DIFF}.
     */
    public static HyperParams fromMap(Map<String, Object> params) {
        return new HyperParams(getNumber(params, Constants.MAX_BINS).intValue(), getNumber(params,
                Constants.MIN_BIN_SIZE).doubleValue(), getNumber(params, Constants.MIN_EVENT_RATE_DIFF).doubleValue());
    }

    private static Number getNumber(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if(!(value instanceof Number)) {
            throw new BinningException(BinningErrorCode.ERROR_GRID_SEARCH_CONFIG, "Search param " + key
                    + " should be a number, but got " + value);
        }
        return (Number) value;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> params = new LinkedHashMap<String, Object>();
        params.put(Constants.MAX_BINS, maxBins);
        params.put(Constants.MIN_BIN_SIZE, minBinSize);
        params.put(Constants.MIN_EVENT_RATE_DIFF, minEventRateDiff);
        return params;
    }

    /**
     * @return a copy of base config with the three searched fields overridden
     * @throws BinningException
     *             if a value is malformed for {@link BinningConfig}
     */
    public BinningConfig applyTo(BinningConfig base) {
        return base.toBuilder().maxBins(maxBins).minBinSize(minBinSize).minEventRateDiff(minEventRateDiff).build();
    }

    public int getMaxBins() {
        return maxBins;
    }

    public double getMinBinSize() {
        return minBinSize;
    }

    public double getMinEventRateDiff() {
        return minEventRateDiff;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof HyperParams)) {
            return false;
        }
        HyperParams other = (HyperParams) obj;
        return maxBins == other.maxBins && Double.compare(minBinSize, other.minBinSize) == 0
                && Double.compare(minEventRateDiff, other.minEventRateDiff) == 0;
    }

    @Override
    public int hashCode() {
        int result = maxBins;
        long bits = Double.doubleToLongBits(minBinSize);
        result = 31 * result + (int) (bits ^ (bits >>> 32));
        bits = Double.doubleToLongBits(minEventRateDiff);
        return 31 * result + (int) (bits ^ (bits >>> 32));
    }

    @Override
    public String toString() {
        return "HyperParams [maxBins=" + maxBins + ", minBinSize=" + minBinSize + ", minEventRateDiff="
                + minEventRateDiff + "]";
    }
}
